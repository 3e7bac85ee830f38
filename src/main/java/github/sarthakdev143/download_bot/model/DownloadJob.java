package github.sarthakdev143.download_bot.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record DownloadJob(
        String id,
        String sourceRef,
        OutputPreset preset,
        RequesterContext requesterContext,
        int attemptCount,
        Instant submittedAt) {

    public DownloadJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceRef, "sourceRef");
        Objects.requireNonNull(preset, "preset");
        requesterContext = requesterContext == null ? RequesterContext.of(null) : requesterContext;
        submittedAt = submittedAt == null ? Instant.now() : submittedAt;
    }

    public static DownloadJob create(String sourceRef, OutputPreset preset, RequesterContext requesterContext) {
        return new DownloadJob(UUID.randomUUID().toString(), sourceRef, preset, requesterContext, 0, Instant.now());
    }

    public DownloadJob nextAttempt() {
        return new DownloadJob(id, sourceRef, preset, requesterContext, attemptCount + 1, submittedAt);
    }
}
