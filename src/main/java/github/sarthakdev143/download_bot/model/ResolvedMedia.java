package github.sarthakdev143.download_bot.model;

import java.util.List;

public record ResolvedMedia(String title, SourcePlatform platform, List<StreamCandidate> candidates) {

    public ResolvedMedia {
        title = title == null || title.isBlank() ? "media" : title;
        platform = platform == null ? SourcePlatform.UNKNOWN : platform;
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
