package github.sarthakdev143.download_bot.pipeline;

import github.sarthakdev143.download_bot.exception.DeliveryException;
import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.MediaArtifact;
import github.sarthakdev143.download_bot.service.DeliveryCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands terminal outcomes to the {@link DeliveryCallback}, retrying a failed handoff once,
 * and always releases the job's staging directory afterwards.
 */
public class ResultSink {

    private static final Logger logger = LoggerFactory.getLogger(ResultSink.class);
    private static final int DELIVERY_ATTEMPTS = 2;

    private final DeliveryCallback deliveryCallback;
    private final StagingArea stagingArea;

    public ResultSink(DeliveryCallback deliveryCallback, StagingArea stagingArea) {
        this.deliveryCallback = deliveryCallback;
        this.stagingArea = stagingArea;
    }

    /**
     * @return {@code true} when the callback acknowledged the artifact
     */
    public boolean deliverSuccess(DownloadJob job, MediaArtifact artifact) {
        try {
            return attemptDelivery(job, "completion",
                    () -> deliveryCallback.onComplete(job.requesterContext(), artifact));
        } finally {
            stagingArea.release(job.id());
        }
    }

    /**
     * Passes the failure kind and detail through as-is; wording for end users is the front
     * end's concern.
     */
    public boolean deliverFailure(DownloadJob job, FailureKind failureKind, String detail) {
        try {
            return attemptDelivery(job, "failure notice",
                    () -> deliveryCallback.onFailure(job.requesterContext(), failureKind, detail));
        } finally {
            stagingArea.release(job.id());
        }
    }

    private boolean attemptDelivery(DownloadJob job, String what, Delivery delivery) {
        for (int attempt = 1; attempt <= DELIVERY_ATTEMPTS; attempt++) {
            try {
                delivery.run();
                return true;
            } catch (DeliveryException e) {
                logger.warn("Delivery of {} for job {} failed on attempt {}/{}",
                        what, job.id(), attempt, DELIVERY_ATTEMPTS, e);
            } catch (RuntimeException e) {
                logger.error("Delivery callback threw unexpectedly for job {} ({})", job.id(), what, e);
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface Delivery {
        void run() throws DeliveryException;
    }
}
