package github.sarthakdev143.download_bot.pipeline;

import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.DownloadJobState;
import github.sarthakdev143.download_bot.model.DownloadJobStatus;
import github.sarthakdev143.download_bot.model.FailureKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Status snapshots for polling. Only the worker owning a job (or the canceller that removed
 * it from the queue) writes its entry. Terminal snapshots are kept for {@code retention}.
 */
public class JobStatusRegistry {

    private final Map<String, DownloadJobStatus> statuses = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public JobStatusRegistry(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    public void register(DownloadJob job) {
        evictExpired();
        Instant now = clock.instant();
        statuses.put(job.id(), new DownloadJobStatus(
                job.id(),
                DownloadJobState.QUEUED,
                "Job queued.",
                now,
                now,
                job.preset(),
                job.attemptCount(),
                null,
                null));
    }

    public void remove(String jobId) {
        statuses.remove(jobId);
    }

    public Optional<DownloadJobStatus> find(String jobId) {
        return Optional.ofNullable(statuses.get(jobId));
    }

    public void updateState(DownloadJob job, DownloadJobState state, String message) {
        statuses.computeIfPresent(job.id(), (ignored, current) -> new DownloadJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                clock.instant(),
                current.preset(),
                job.attemptCount(),
                current.failureKind(),
                current.artifactName()));
    }

    public void markDone(DownloadJob job, String artifactName) {
        statuses.computeIfPresent(job.id(), (ignored, current) -> new DownloadJobStatus(
                current.jobId(),
                DownloadJobState.DONE,
                "Download delivered.",
                current.createdAt(),
                clock.instant(),
                current.preset(),
                job.attemptCount(),
                null,
                artifactName));
    }

    public void markFailed(DownloadJob job, FailureKind failureKind, String message) {
        statuses.computeIfPresent(job.id(), (ignored, current) -> new DownloadJobStatus(
                current.jobId(),
                DownloadJobState.FAILED,
                message,
                current.createdAt(),
                clock.instant(),
                current.preset(),
                job.attemptCount(),
                failureKind,
                current.artifactName()));
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        statuses.values().removeIf(status -> status.state().isTerminal() && status.updatedAt().isBefore(cutoff));
    }
}
