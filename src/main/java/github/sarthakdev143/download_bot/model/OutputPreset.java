package github.sarthakdev143.download_bot.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum OutputPreset {
    AUDIO_MP3_128K("audio-mp3-128k", "mp3", false),
    AUDIO_MP3_192K("audio-mp3-192k", "mp3", false),
    AUDIO_MP3_320K("audio-mp3-320k", "mp3", false),
    AUDIO_M4A_AAC_192K("audio-m4a-aac-192k", "m4a", false),
    VIDEO_H264_1080P("video-h264-1080p", "mp4", true),
    VIDEO_H264_720P("video-h264-720p", "mp4", true),
    VIDEO_H264_480P("video-h264-480p", "mp4", true);

    private final String presetName;
    private final String fileExtension;
    private final boolean video;

    OutputPreset(String presetName, String fileExtension, boolean video) {
        this.presetName = presetName;
        this.fileExtension = fileExtension;
        this.video = video;
    }

    public String presetName() {
        return presetName;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public boolean video() {
        return video;
    }

    public static OutputPreset fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("preset is required. Supported presets: " + names() + ".");
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(preset -> preset.presetName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "preset must be one of " + names() + "."));
    }

    public static List<String> names() {
        return Arrays.stream(values())
                .map(OutputPreset::presetName)
                .toList();
    }
}
