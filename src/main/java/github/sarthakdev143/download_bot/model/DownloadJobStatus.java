package github.sarthakdev143.download_bot.model;

import java.time.Instant;

public record DownloadJobStatus(
        String jobId,
        DownloadJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        OutputPreset preset,
        int attemptCount,
        FailureKind failureKind,
        String artifactName) {
}
