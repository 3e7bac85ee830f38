package github.sarthakdev143.download_bot.integration.ytdlp;

import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.integration.process.SubprocessRunner;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.ResolvedMedia;
import github.sarthakdev143.download_bot.model.SourcePlatform;
import github.sarthakdev143.download_bot.model.StreamCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YtDlpStreamResolverTest {

    private static final String FORMATS_JSON = """
            {
              "title": "Lo-fi beats",
              "formats": [
                {"format_id": "hls-720", "url": "https://cdn.example.com/720.m3u8", "protocol": "m3u8_native",
                 "vcodec": "avc1", "acodec": "mp4a", "height": 720},
                {"format_id": "140", "url": "https://cdn.example.com/140.m4a", "ext": "m4a", "protocol": "https",
                 "vcodec": "none", "acodec": "mp4a.40.2", "abr": 129.5, "filesize": 3450123},
                {"format_id": "251", "url": "https://cdn.example.com/251.webm", "ext": "webm", "protocol": "https",
                 "vcodec": "none", "acodec": "opus", "abr": 160.1, "filesize_approx": 3900000.0},
                {"format_id": "18", "url": "https://cdn.example.com/18.mp4", "ext": "mp4", "protocol": "https",
                 "vcodec": "avc1.42001E", "acodec": "mp4a.40.2", "height": 360, "tbr": 500.0},
                {"format_id": "22", "url": "https://cdn.example.com/22.mp4", "ext": "mp4", "protocol": "https",
                 "vcodec": "avc1.64001F", "acodec": "mp4a.40.2", "height": 720, "tbr": 1200.0},
                {"format_id": "137", "url": "https://cdn.example.com/137.mp4", "ext": "mp4", "protocol": "https",
                 "vcodec": "avc1.640028", "acodec": "none", "height": 1080},
                {"format_id": "sb0", "url": "https://cdn.example.com/sb0.mhtml", "ext": "mhtml", "protocol": "mhtml",
                 "vcodec": "none", "acodec": "none"},
                {"format_id": "tiny", "url": "https://cdn.example.com/tiny.mp4", "ext": "mp4", "protocol": "https",
                 "vcodec": "avc1", "acodec": "mp4a", "height": 1440, "filesize": 2048},
                {"format_id": "nourl", "ext": "mp4", "vcodec": "avc1", "acodec": "mp4a", "height": 2160}
              ]
            }
            """;

    @TempDir
    Path workDir;

    private DownloadBotProperties properties;
    private YtDlpStreamResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new DownloadBotProperties();
        resolver = new YtDlpStreamResolver(properties, new SubprocessRunner());
    }

    @Test
    void supportsAnyHttpUrl() {
        assertThat(resolver.supports("https://www.tiktok.com/@user/video/123")).isTrue();
        assertThat(resolver.supports("http://example.com/page")).isTrue();
        assertThat(resolver.supports("file:///etc/passwd")).isFalse();
        assertThat(resolver.supports("just text")).isFalse();
    }

    @Test
    void buildCommandEndsOptionsBeforeTheUrl() {
        properties.setYtDlpPath("/usr/local/bin/yt-dlp");

        List<String> command = resolver.buildCommand("https://youtu.be/abc");

        assertThat(command).containsExactly(
                "/usr/local/bin/yt-dlp", "-J", "--no-playlist", "--no-warnings", "--", "https://youtu.be/abc");
    }

    private static final String SPLIT_TRACKS_JSON = """
            {
              "title": "Clip without a combined format",
              "formats": [
                {"format_id": "140", "url": "https://cdn.example.com/140.m4a", "ext": "m4a", "protocol": "https",
                 "vcodec": "none", "acodec": "mp4a.40.2", "abr": 129.5},
                {"format_id": "137", "url": "https://cdn.example.com/137.mp4", "ext": "mp4", "protocol": "https",
                 "vcodec": "avc1.640028", "acodec": "none", "height": 1080}
              ]
            }
            """;

    @Test
    void videoRankingPrefersMuxedStreamsThenPairsVideoWithBestAudio() throws IOException {
        List<StreamCandidate> candidates = resolver.rankCandidates(parse(FORMATS_JSON), OutputPreset.VIDEO_H264_1080P);

        assertThat(candidates).extracting(StreamCandidate::uri).containsExactly(
                "https://cdn.example.com/22.mp4",
                "https://cdn.example.com/18.mp4",
                "https://cdn.example.com/137.mp4");
        assertThat(candidates.get(0).audioTrack()).isNull();
        assertThat(candidates.get(2).audioTrack().uri()).isEqualTo("https://cdn.example.com/251.webm");
        assertThat(candidates).allMatch(StreamCandidate::carriesAudio);
    }

    @Test
    void audioRankingPrefersAudioOnlyByBitrateThenSmallestMuxed() throws IOException {
        List<StreamCandidate> candidates = resolver.rankCandidates(parse(FORMATS_JSON), OutputPreset.AUDIO_MP3_128K);

        assertThat(candidates).extracting(StreamCandidate::uri).containsExactly(
                "https://cdn.example.com/251.webm",
                "https://cdn.example.com/140.m4a",
                "https://cdn.example.com/18.mp4",
                "https://cdn.example.com/22.mp4");
        assertThat(candidates).allMatch(StreamCandidate::hasAudio);
    }

    @Test
    void splitTrackSourceGivesAudioJobsTheAudioFormat() throws IOException {
        List<StreamCandidate> candidates = resolver.rankCandidates(parse(SPLIT_TRACKS_JSON), OutputPreset.AUDIO_MP3_192K);

        assertThat(candidates).singleElement().satisfies(best -> {
            assertThat(best.uri()).isEqualTo("https://cdn.example.com/140.m4a");
            assertThat(best.hasAudio()).isTrue();
            assertThat(best.hasVideo()).isFalse();
        });
    }

    @Test
    void splitTrackSourceGivesVideoJobsVideoWithAudioTrack() throws IOException {
        List<StreamCandidate> candidates = resolver.rankCandidates(parse(SPLIT_TRACKS_JSON), OutputPreset.VIDEO_H264_720P);

        assertThat(candidates).singleElement().satisfies(best -> {
            assertThat(best.uri()).isEqualTo("https://cdn.example.com/137.mp4");
            assertThat(best.hasVideo()).isTrue();
            assertThat(best.carriesAudio()).isTrue();
            assertThat(best.audioTrack().uri()).isEqualTo("https://cdn.example.com/140.m4a");
        });
    }

    @Test
    void silentSourceStillOffersVideoButNothingForAudioJobs() throws IOException {
        YtDlpInfo info = parse("""
                {"title": "Gif", "formats": [
                  {"format_id": "v", "url": "https://cdn.example.com/v.mp4", "ext": "mp4", "protocol": "https",
                   "vcodec": "avc1", "acodec": "none", "height": 480}
                ]}
                """);

        assertThat(resolver.rankCandidates(info, OutputPreset.VIDEO_H264_480P)).singleElement().satisfies(only -> {
            assertThat(only.audioTrack()).isNull();
            assertThat(only.carriesAudio()).isFalse();
        });
        assertThat(resolver.rankCandidates(info, OutputPreset.AUDIO_M4A_AAC_192K)).isEmpty();
    }

    @Test
    void onlyExactSizesAreCarriedForVerification() throws IOException {
        List<StreamCandidate> candidates = resolver.rankCandidates(parse(FORMATS_JSON), OutputPreset.AUDIO_MP3_128K);

        StreamCandidate opus = candidates.get(0);
        StreamCandidate aac = candidates.get(1);
        assertThat(opus.expectedSizeBytes()).isNull();
        assertThat(aac.expectedSizeBytes()).isEqualTo(3_450_123L);
        assertThat(aac.hasVideo()).isFalse();
        assertThat(aac.hasAudio()).isTrue();
    }

    @Test
    void singleFileExtractionsUseTopLevelUrl() throws IOException {
        YtDlpInfo info = parse("""
                {"title": "Reel", "url": "https://scontent.example.com/reel.mp4", "ext": "mp4",
                 "vcodec": "h264", "acodec": "aac", "height": 1920}
                """);

        List<StreamCandidate> candidates = resolver.rankCandidates(info, OutputPreset.VIDEO_H264_1080P);

        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.uri()).isEqualTo("https://scontent.example.com/reel.mp4");
            assertThat(candidate.height()).isEqualTo(1920);
            assertThat(candidate.hasVideo()).isTrue();
        });
    }

    @Test
    void nothingUsableYieldsNoCandidates() throws IOException {
        YtDlpInfo info = parse("""
                {"title": "Live", "formats": [
                  {"format_id": "hls", "url": "https://cdn.example.com/live.m3u8", "protocol": "m3u8"}
                ]}
                """);

        assertThat(resolver.rankCandidates(info, OutputPreset.AUDIO_MP3_128K)).isEmpty();
    }

    @Test
    void classifyFailureSeparatesUnavailableFromTransient() {
        assertThat(resolver.classifyFailure("ERROR: [youtube] abc: Private video. Sign in if you've been granted access"))
                .isEqualTo(FailureKind.RESOLVE_ERROR);
        assertThat(resolver.classifyFailure("ERROR: Unable to download webpage: HTTP Error 503: Service Unavailable"))
                .isEqualTo(FailureKind.NETWORK_ERROR);
        assertThat(resolver.classifyFailure("ERROR: something odd")).isEqualTo(FailureKind.RESOLVE_ERROR);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resolveRunsYtDlpAndParsesItsJson() throws Exception {
        Path json = Files.writeString(workDir.resolve("info.json"), FORMATS_JSON);
        useFakeYtDlp("cat '" + json + "'\n");

        ResolvedMedia media = resolver.resolve("https://www.youtube.com/watch?v=abc", OutputPreset.VIDEO_H264_720P);

        assertThat(media.title()).isEqualTo("Lo-fi beats");
        assertThat(media.platform()).isEqualTo(SourcePlatform.YOUTUBE);
        assertThat(media.candidates()).hasSize(3);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resolveMapsPrivateVideoToResolveError() throws Exception {
        useFakeYtDlp("echo 'ERROR: [youtube] abc: Private video' >&2\nexit 1\n");

        assertThatThrownBy(() -> resolver.resolve("https://www.youtube.com/watch?v=abc", OutputPreset.AUDIO_MP3_128K))
                .isInstanceOf(MediaPipelineException.class)
                .hasMessageContaining("Private video")
                .extracting(e -> ((MediaPipelineException) e).kind())
                .isEqualTo(FailureKind.RESOLVE_ERROR);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resolveWithoutFormatsIsUnsupportedFormat() throws Exception {
        useFakeYtDlp("echo '{\"title\": \"Protected\", \"formats\": []}'\n");

        assertThatThrownBy(() -> resolver.resolve("https://www.instagram.com/p/xyz/", OutputPreset.VIDEO_H264_480P))
                .isInstanceOf(MediaPipelineException.class)
                .extracting(e -> ((MediaPipelineException) e).kind())
                .isEqualTo(FailureKind.UNSUPPORTED_FORMAT);
    }

    @Test
    void missingYtDlpBinaryIsResolveError() {
        properties.setYtDlpPath(workDir.resolve("no-such-yt-dlp").toString());

        assertThatThrownBy(() -> resolver.resolve("https://vimeo.com/123", OutputPreset.AUDIO_MP3_320K))
                .isInstanceOf(MediaPipelineException.class)
                .extracting(e -> ((MediaPipelineException) e).kind())
                .isEqualTo(FailureKind.RESOLVE_ERROR);
    }

    private YtDlpInfo parse(String json) throws IOException {
        return resolver.parseInfo(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private void useFakeYtDlp(String body) throws IOException {
        Path script = workDir.resolve("fake-yt-dlp.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        properties.setYtDlpPath(script.toString());
    }
}
