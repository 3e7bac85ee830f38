package github.sarthakdev143.download_bot.model;

public enum FailureKind {
    RESOLVE_ERROR(false),
    NETWORK_ERROR(true),
    UNSUPPORTED_FORMAT(false),
    UNSUPPORTED_CODEC(false),
    TOOLCHAIN_ERROR(false),
    TIMEOUT(false),
    DELIVERY_ERROR(false),
    CANCELLED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
