package github.sarthakdev143.download_bot.pipeline;

import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.exception.QueueSaturatedException;
import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.DownloadJobState;
import github.sarthakdev143.download_bot.model.DownloadJobStatus;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.FetchedMedia;
import github.sarthakdev143.download_bot.model.MediaArtifact;
import github.sarthakdev143.download_bot.service.MediaFetcher;
import github.sarthakdev143.download_bot.service.MediaTranscoder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool driving each job through fetch, transcode and delivery.
 *
 * <p>One instance per process, created with an explicit lifecycle: {@link #start()} spins up
 * {@code pool-size} workers, {@link #drainAndStop(Duration)} stops intake, lets queued and
 * in-flight jobs finish, and fails whatever is left with {@link FailureKind#CANCELLED}.
 *
 * <p>A worker owns a job from dequeue until its terminal delivery; nothing else advances that
 * job's state. Retries go to the back of the queue instead of looping in place, so workers
 * keep no state between jobs.
 */
public class DownloadPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DownloadPipeline.class);
    private static final Duration DRAIN_CHECK_INTERVAL = Duration.ofMillis(20);

    private final DownloadJobQueue queue;
    private final MediaFetcher fetcher;
    private final MediaTranscoder transcoder;
    private final ResultSink resultSink;
    private final StagingArea stagingArea;
    private final JobStatusRegistry statusRegistry;
    private final MeterRegistry meterRegistry;
    private final int poolSize;
    private final int maxAttempts;
    private final Duration pollInterval;
    private final Duration drainTimeout;

    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter retriedCounter;
    private final Counter rejectedCounter;

    private volatile boolean accepting;
    private volatile boolean running;
    private ExecutorService workers;

    public DownloadPipeline(
            DownloadJobQueue queue,
            MediaFetcher fetcher,
            MediaTranscoder transcoder,
            ResultSink resultSink,
            StagingArea stagingArea,
            JobStatusRegistry statusRegistry,
            MeterRegistry meterRegistry,
            DownloadBotProperties properties) {
        this.queue = queue;
        this.fetcher = fetcher;
        this.transcoder = transcoder;
        this.resultSink = resultSink;
        this.stagingArea = stagingArea;
        this.statusRegistry = statusRegistry;
        this.meterRegistry = meterRegistry;
        this.poolSize = properties.getPoolSize();
        this.maxAttempts = properties.getMaxAttempts();
        this.pollInterval = properties.getWorkerPollInterval();
        this.drainTimeout = properties.getDrainTimeout();
        this.submittedCounter = meterRegistry.counter("download_bot.jobs.submitted");
        this.completedCounter = meterRegistry.counter("download_bot.jobs.completed");
        this.retriedCounter = meterRegistry.counter("download_bot.jobs.retried");
        this.rejectedCounter = meterRegistry.counter("download_bot.queue.rejected");
        Gauge.builder("download_bot.jobs.in_flight", inFlight, AtomicInteger::get).register(meterRegistry);
        Gauge.builder("download_bot.queue.size", queue, DownloadJobQueue::size).register(meterRegistry);
    }

    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Download pipeline is already running.");
        }
        if (queue.isClosed()) {
            throw new IllegalStateException("Download pipeline cannot be restarted once stopped.");
        }

        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "download-worker-" + workerIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        accepting = true;
        for (int i = 0; i < poolSize; i++) {
            workers.execute(this::workerLoop);
        }
        logger.info("Download pipeline started with {} workers, maxAttempts={}, queueCapacity={}",
                poolSize, maxAttempts, queue.capacity());
    }

    public void drainAndStop() {
        drainAndStop(drainTimeout);
    }

    public synchronized void drainAndStop(Duration timeout) {
        if (!running) {
            return;
        }

        accepting = false;
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while ((queue.size() > 0 || inFlight.get() > 0) && System.nanoTime() < deadline) {
                Thread.sleep(DRAIN_CHECK_INTERVAL.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        running = false;
        workers.shutdown();
        try {
            long remainingNanos = Math.max(deadline - System.nanoTime(), pollInterval.toNanos() * 2);
            if (!workers.awaitTermination(remainingNanos, TimeUnit.NANOSECONDS)) {
                logger.warn("Workers still busy after drain timeout; interrupting them");
                workers.shutdownNow();
                workers.awaitTermination(pollInterval.toMillis() * 2, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<DownloadJob> leftovers = queue.closeAndDrain();
        for (DownloadJob job : leftovers) {
            fail(job, FailureKind.CANCELLED, "Pipeline stopped before the job was processed.");
        }
        logger.info("Download pipeline stopped; {} queued jobs were cancelled", leftovers.size());
    }

    /**
     * Queues a job for processing.
     *
     * @throws QueueSaturatedException when the queue is full; the job is not recorded
     * @throws IllegalStateException   when the pipeline is not accepting jobs
     */
    public String submit(DownloadJob job) {
        if (!accepting) {
            throw new IllegalStateException("Download pipeline is not accepting jobs.");
        }

        statusRegistry.register(job);
        try {
            queue.submit(job);
        } catch (QueueSaturatedException e) {
            statusRegistry.remove(job.id());
            rejectedCounter.increment();
            throw e;
        } catch (IllegalStateException e) {
            // stop closed the queue after the accepting check above
            statusRegistry.remove(job.id());
            throw new IllegalStateException("Download pipeline is not accepting jobs.", e);
        }
        submittedCounter.increment();
        return job.id();
    }

    public Optional<DownloadJobStatus> status(String jobId) {
        return statusRegistry.find(jobId);
    }

    /**
     * Cancels a job. A queued job is removed and failed right away without touching the
     * fetcher or transcoder; an in-flight job is flagged and its worker stops at the next
     * stage boundary.
     *
     * @return {@code false} when the job is unknown or already terminal
     */
    public boolean cancel(String jobId) {
        Optional<DownloadJobStatus> status = statusRegistry.find(jobId);
        if (status.isEmpty() || status.get().state().isTerminal()) {
            return false;
        }

        cancelRequests.add(jobId);
        Optional<DownloadJob> queued = queue.remove(jobId);
        if (queued.isPresent()) {
            logger.info("Cancelled queued job {}", jobId);
            fail(queued.get(), FailureKind.CANCELLED, "Cancelled before processing.");
            return true;
        }

        if (statusRegistry.find(jobId).map(current -> current.state().isTerminal()).orElse(true)) {
            cancelRequests.remove(jobId);
            return false;
        }
        logger.info("Cancellation requested for in-flight job {}", jobId);
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    public int peakInFlightCount() {
        return peakInFlight.get();
    }

    int pendingCancellationCount() {
        return cancelRequests.size();
    }

    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Optional<DownloadJob> next;
            try {
                next = queue.poll(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            next.ifPresent(this::process);
        }
    }

    private void process(DownloadJob job) {
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            runStages(job);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while processing job {}", job.id(), e);
            fail(job, FailureKind.TOOLCHAIN_ERROR, "Unexpected internal error: " + e.getMessage());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void runStages(DownloadJob job) {
        if (isCancelRequested(job)) {
            fail(job, FailureKind.CANCELLED, "Cancelled before fetching.");
            return;
        }

        Path stagingDirectory;
        try {
            stagingDirectory = stagingArea.create(job.id());
        } catch (IOException e) {
            logger.error("Could not prepare staging for job {}", job.id(), e);
            fail(job, FailureKind.TOOLCHAIN_ERROR, "Could not prepare staging storage.");
            return;
        }

        statusRegistry.updateState(job, DownloadJobState.FETCHING,
                "Fetching media (attempt " + (job.attemptCount() + 1) + " of " + maxAttempts + ").");
        FetchedMedia fetched;
        try {
            fetched = fetcher.fetch(job.sourceRef(), job.preset(), stagingDirectory);
        } catch (MediaPipelineException e) {
            handleFetchFailure(job, e);
            return;
        } catch (RuntimeException e) {
            logger.error("Fetcher threw unexpectedly for job {}", job.id(), e);
            fail(job, FailureKind.RESOLVE_ERROR, "Unexpected fetch failure: " + e.getMessage());
            return;
        }
        logger.info("Fetched job {} title='{}' bytes={}", job.id(), fetched.title(), fetched.sizeBytes());

        if (isCancelRequested(job)) {
            fail(job, FailureKind.CANCELLED, "Cancelled after fetching.");
            return;
        }

        statusRegistry.updateState(job, DownloadJobState.TRANSCODING,
                "Transcoding to " + job.preset().presetName() + ".");
        Path output;
        try {
            output = transcoder.transcode(fetched, job.preset(), stagingDirectory);
        } catch (MediaPipelineException e) {
            logger.warn("Transcoding failed for job {} kind={}: {}", job.id(), e.kind(), e.getMessage());
            fail(job, e.kind(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.error("Transcoder threw unexpectedly for job {}", job.id(), e);
            fail(job, FailureKind.TOOLCHAIN_ERROR, "Unexpected transcode failure: " + e.getMessage());
            return;
        }

        if (isCancelRequested(job)) {
            fail(job, FailureKind.CANCELLED, "Cancelled after transcoding.");
            return;
        }

        statusRegistry.updateState(job, DownloadJobState.DELIVERING, "Delivering artifact.");
        MediaArtifact artifact = new MediaArtifact(output, fetched.title(), job.preset(), sizeOf(output));
        String artifactName = artifact.fileName();
        if (resultSink.deliverSuccess(job, artifact)) {
            statusRegistry.markDone(job, artifactName);
            cancelRequests.remove(job.id());
            completedCounter.increment();
            logger.info("Completed download job {} preset={} attempts={}",
                    job.id(), job.preset().presetName(), job.attemptCount() + 1);
        } else {
            fail(job, FailureKind.DELIVERY_ERROR, "Artifact could not be handed to the requester.");
        }
    }

    private void handleFetchFailure(DownloadJob job, MediaPipelineException failure) {
        boolean attemptsLeft = job.attemptCount() + 1 < maxAttempts;
        if (failure.isRetryable() && attemptsLeft && !isCancelRequested(job)) {
            stagingArea.release(job.id());
            DownloadJob retry = job.nextAttempt();
            statusRegistry.updateState(retry, DownloadJobState.QUEUED,
                    "Requeued after " + failure.kind() + ": " + failure.getMessage());
            if (!queue.requeue(retry)) {
                fail(retry, FailureKind.CANCELLED, "Pipeline stopped before the retry could run.");
                return;
            }
            retriedCounter.increment();
            logger.warn("Fetch failed for job {} on attempt {}/{}; requeued: {}",
                    job.id(), job.attemptCount() + 1, maxAttempts, failure.getMessage());
            return;
        }

        logger.warn("Fetch failed for job {} kind={} after {} attempt(s): {}",
                job.id(), failure.kind(), job.attemptCount() + 1, failure.getMessage());
        fail(job, failure.kind(), failure.getMessage());
    }

    private void fail(DownloadJob job, FailureKind failureKind, String detail) {
        if (!resultSink.deliverFailure(job, failureKind, detail)) {
            logger.error("Failure notice for job {} could not be delivered (kind={})", job.id(), failureKind);
        }
        // terminal status first, so a cancel racing with this sees it and drops its own flag
        statusRegistry.markFailed(job, failureKind, detail);
        cancelRequests.remove(job.id());
        meterRegistry.counter("download_bot.jobs.failed", "kind", failureKind.name()).increment();
    }

    private boolean isCancelRequested(DownloadJob job) {
        return cancelRequests.contains(job.id());
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            logger.warn("Could not read size of {}", file, e);
            return -1L;
        }
    }
}
