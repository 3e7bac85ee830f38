package github.sarthakdev143.download_bot.exception;

import github.sarthakdev143.download_bot.model.FailureKind;

import java.util.Objects;

/**
 * Typed failure raised by a pipeline stage. Stages never retry on their own; the worker pool
 * reads {@link #kind()} to decide between requeue and terminal failure.
 */
public class MediaPipelineException extends Exception {

    private final FailureKind kind;

    public MediaPipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MediaPipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
