package github.sarthakdev143.download_bot.service;

import github.sarthakdev143.download_bot.model.DownloadJobStatus;
import github.sarthakdev143.download_bot.model.RequesterContext;

import java.util.Optional;

public interface DownloadService {

    /**
     * Accepts a download request without waiting for any processing.
     *
     * @return the id of the queued job
     * @throws IllegalArgumentException when the source reference or preset is invalid
     * @throws github.sarthakdev143.download_bot.exception.QueueSaturatedException when the queue is full
     */
    String submit(String sourceRef, String presetName, RequesterContext requesterContext);

    Optional<DownloadJobStatus> getJobStatus(String jobId);

    boolean cancel(String jobId);
}
