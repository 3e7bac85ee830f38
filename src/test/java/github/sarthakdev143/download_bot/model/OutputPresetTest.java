package github.sarthakdev143.download_bot.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputPresetTest {

    @Test
    void fromInputAcceptsNamesCaseInsensitively() {
        assertThat(OutputPreset.fromInput("audio-mp3-192k")).isEqualTo(OutputPreset.AUDIO_MP3_192K);
        assertThat(OutputPreset.fromInput("  VIDEO-H264-720P ")).isEqualTo(OutputPreset.VIDEO_H264_720P);
    }

    @Test
    void fromInputRejectsUnknownPresetWithSupportedList() {
        assertThatThrownBy(() -> OutputPreset.fromInput("flac-lossless"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("audio-mp3-128k");
    }

    @Test
    void fromInputRejectsBlank() {
        assertThatThrownBy(() -> OutputPreset.fromInput(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("preset is required");
    }

    @Test
    void extensionsFollowContainerOfPreset() {
        assertThat(OutputPreset.AUDIO_MP3_320K.fileExtension()).isEqualTo("mp3");
        assertThat(OutputPreset.AUDIO_M4A_AAC_192K.fileExtension()).isEqualTo("m4a");
        assertThat(OutputPreset.VIDEO_H264_1080P.fileExtension()).isEqualTo("mp4");
        assertThat(OutputPreset.VIDEO_H264_1080P.video()).isTrue();
        assertThat(OutputPreset.AUDIO_MP3_128K.video()).isFalse();
    }

    @Test
    void namesListsEveryPresetOnce() {
        assertThat(OutputPreset.names())
                .hasSize(OutputPreset.values().length)
                .doesNotHaveDuplicates()
                .contains("audio-m4a-aac-192k", "video-h264-480p");
    }
}
