package github.sarthakdev143.download_bot.model;

public enum DownloadJobState {
    QUEUED,
    FETCHING,
    TRANSCODING,
    DELIVERING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
