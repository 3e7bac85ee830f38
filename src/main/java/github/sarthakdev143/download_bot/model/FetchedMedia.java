package github.sarthakdev143.download_bot.model;

import java.nio.file.Path;

public record FetchedMedia(Path file, Path audioFile, String title, long sizeBytes, StreamCandidate source) {

    public FetchedMedia(Path file, String title, long sizeBytes, StreamCandidate source) {
        this(file, null, title, sizeBytes, source);
    }
}
