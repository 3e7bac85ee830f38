package github.sarthakdev143.download_bot.model;

import java.nio.file.Path;

public record MediaArtifact(Path file, String title, OutputPreset preset, long sizeBytes) {

    public String fileName() {
        return file.getFileName().toString();
    }
}
