package github.sarthakdev143.download_bot.integration.ytdlp;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.integration.http.SourceUrls;
import github.sarthakdev143.download_bot.integration.process.SubprocessRunner;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.ResolvedMedia;
import github.sarthakdev143.download_bot.model.SourcePlatform;
import github.sarthakdev143.download_bot.model.StreamCandidate;
import github.sarthakdev143.download_bot.service.StreamResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves page URLs (YouTube, TikTok, Reddit and anything else yt-dlp has an extractor for)
 * by asking {@code yt-dlp -J} for the format list. Registered after the direct link resolver,
 * so it is the catch-all for http(s) references.
 */
@Component
@Order(2)
public class YtDlpStreamResolver implements StreamResolver {

    private static final Logger logger = LoggerFactory.getLogger(YtDlpStreamResolver.class);
    private static final int MAX_CANDIDATES = 10;
    private static final long MIN_USEFUL_BYTES = 10_486L;
    private static final int DIAGNOSTIC_TAIL_CHARS = 400;
    private static final Set<String> MANIFEST_PROTOCOLS = Set.of(
            "m3u8",
            "m3u8_native",
            "dash",
            "http_dash_segments",
            "f4m",
            "ism");
    private static final List<String> UNAVAILABLE_MARKERS = List.of(
            "private video",
            "copyright",
            "video unavailable",
            "unsupported url",
            "is not a valid url",
            "sign in to confirm");
    private static final List<String> NETWORK_MARKERS = List.of(
            "unable to download webpage",
            "timed out",
            "connection reset",
            "connection refused",
            "temporary failure in name resolution",
            "http error 5",
            "http error 429");

    private final DownloadBotProperties properties;
    private final SubprocessRunner subprocessRunner;
    private final JsonFactory jsonFactory = GsonFactory.getDefaultInstance();

    public YtDlpStreamResolver(DownloadBotProperties properties, SubprocessRunner subprocessRunner) {
        this.properties = properties;
        this.subprocessRunner = subprocessRunner;
    }

    @Override
    public boolean supports(String sourceRef) {
        return SourceUrls.parseHttpUrl(sourceRef).isPresent();
    }

    @Override
    public ResolvedMedia resolve(String sourceRef, OutputPreset preset) throws MediaPipelineException {
        String url = SourceUrls.parseHttpUrl(sourceRef)
                .orElseThrow(() -> new MediaPipelineException(FailureKind.RESOLVE_ERROR, "Not an http(s) URL."))
                .toString();
        SourcePlatform platform = SourcePlatform.detect(url);

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("download-bot-ytdlp-", ".json");
            stderr = Files.createTempFile("download-bot-ytdlp-", ".log");
            SubprocessRunner.Result result = subprocessRunner.run(
                    buildCommand(url),
                    null,
                    stdout,
                    stderr,
                    properties.getResolveTimeout());

            if (result.timedOut()) {
                throw new MediaPipelineException(FailureKind.NETWORK_ERROR, "yt-dlp timed out while resolving the source.");
            }
            if (result.exitCode() != 0) {
                String diagnostics = SubprocessRunner.tail(stderr, DIAGNOSTIC_TAIL_CHARS);
                throw new MediaPipelineException(classifyFailure(diagnostics), "yt-dlp could not resolve source: " + diagnostics);
            }

            YtDlpInfo info;
            try (InputStream json = Files.newInputStream(stdout)) {
                info = parseInfo(json);
            }
            List<StreamCandidate> candidates = rankCandidates(info, preset);
            logger.info("yt-dlp resolved {} link to '{}' with {} usable format(s) for {}",
                    platform.displayName(), info.getTitle(), candidates.size(), preset.presetName());
            if (candidates.isEmpty()) {
                throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                        "No suitable download formats found or media is protected.");
            }
            return new ResolvedMedia(info.getTitle(), platform, candidates);
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.RESOLVE_ERROR, "yt-dlp is unavailable or returned unreadable output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaPipelineException(FailureKind.CANCELLED, "Resolution was interrupted.", e);
        } catch (IllegalArgumentException e) {
            throw new MediaPipelineException(FailureKind.RESOLVE_ERROR, "yt-dlp returned malformed JSON: " + e.getMessage(), e);
        } finally {
            deleteIfExists(stdout);
            deleteIfExists(stderr);
        }
    }

    List<String> buildCommand(String url) {
        return List.of(
                properties.getYtDlpPath(),
                "-J",
                "--no-playlist",
                "--no-warnings",
                "--",
                url);
    }

    YtDlpInfo parseInfo(InputStream json) throws IOException {
        return jsonFactory.createJsonParser(json, StandardCharsets.UTF_8).parseAndClose(YtDlpInfo.class);
    }

    /**
     * Drops manifests and near-empty formats. Audio presets get audio-only formats by bitrate,
     * then muxed formats smallest first. Video presets get muxed formats by height, then
     * video-only formats paired with the best audio-only format.
     */
    List<StreamCandidate> rankCandidates(YtDlpInfo info, OutputPreset preset) {
        if (info.getFormats().isEmpty()) {
            if (info.getUrl() == null || info.getUrl().isBlank()) {
                return List.of();
            }
            return List.of(new StreamCandidate(
                    info.getUrl(),
                    info.getExt(),
                    !"none".equals(info.getVcodec()),
                    !"none".equals(info.getAcodec()),
                    info.getHeight(),
                    info.getFilesize() == null ? null : info.getFilesize().longValue()));
        }

        List<YtDlpInfo.Format> usable = info.getFormats().stream()
                .filter(this::isUsable)
                .toList();
        List<YtDlpInfo.Format> muxed = usable.stream()
                .filter(format -> hasVideo(format) && hasAudio(format))
                .toList();
        List<YtDlpInfo.Format> audioOnly = usable.stream()
                .filter(format -> !hasVideo(format))
                .sorted(Comparator.comparingDouble(YtDlpStreamResolver::bitrateOf).reversed())
                .toList();

        if (!preset.video()) {
            return Stream.concat(
                            audioOnly.stream(),
                            muxed.stream().sorted(Comparator.comparingInt(YtDlpStreamResolver::heightOf)))
                    .limit(MAX_CANDIDATES)
                    .map(YtDlpStreamResolver::toCandidate)
                    .toList();
        }

        Comparator<YtDlpInfo.Format> tallestFirst = Comparator
                .comparingInt(YtDlpStreamResolver::heightOf).reversed()
                .thenComparing(Comparator.comparingDouble(YtDlpStreamResolver::bitrateOf).reversed());
        Optional<StreamCandidate> bestAudioTrack = audioOnly.stream().findFirst().map(YtDlpStreamResolver::toCandidate);
        Stream<StreamCandidate> withSound = muxed.stream()
                .sorted(tallestFirst)
                .map(YtDlpStreamResolver::toCandidate);
        Stream<StreamCandidate> paired = usable.stream()
                .filter(format -> !hasAudio(format))
                .sorted(tallestFirst)
                .map(format -> {
                    StreamCandidate video = toCandidate(format);
                    return bestAudioTrack.map(video::withAudioTrack).orElse(video);
                });
        return Stream.concat(withSound, paired)
                .limit(MAX_CANDIDATES)
                .toList();
    }

    FailureKind classifyFailure(String diagnostics) {
        String normalized = diagnostics.toLowerCase(Locale.ROOT);
        if (UNAVAILABLE_MARKERS.stream().anyMatch(normalized::contains)) {
            return FailureKind.RESOLVE_ERROR;
        }
        if (NETWORK_MARKERS.stream().anyMatch(normalized::contains)) {
            return FailureKind.NETWORK_ERROR;
        }
        return FailureKind.RESOLVE_ERROR;
    }

    private boolean isUsable(YtDlpInfo.Format format) {
        if (format.getUrl() == null || format.getUrl().isBlank()) {
            return false;
        }
        String protocol = format.getProtocol() == null ? "" : format.getProtocol().toLowerCase(Locale.ROOT);
        if (MANIFEST_PROTOCOLS.contains(protocol)) {
            return false;
        }
        Long size = format.knownSize();
        if (size != null && size < MIN_USEFUL_BYTES) {
            return false;
        }
        return hasVideo(format) || hasAudio(format);
    }

    private static StreamCandidate toCandidate(YtDlpInfo.Format format) {
        return new StreamCandidate(
                format.getUrl(),
                format.getExt(),
                hasVideo(format),
                hasAudio(format),
                format.getHeight(),
                format.getFilesize() == null ? null : format.getFilesize().longValue());
    }

    private static int heightOf(YtDlpInfo.Format format) {
        return format.getHeight() == null ? 0 : format.getHeight();
    }

    private static double bitrateOf(YtDlpInfo.Format format) {
        if (format.getAbr() != null) {
            return format.getAbr();
        }
        return format.getTbr() == null ? 0.0 : format.getTbr();
    }

    // yt-dlp reports "none" for an absent track; a missing field means unknown, treated as present.
    private static boolean hasVideo(YtDlpInfo.Format format) {
        return !"none".equals(format.getVcodec());
    }

    private static boolean hasAudio(YtDlpInfo.Format format) {
        return !"none".equals(format.getAcodec());
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete yt-dlp scratch file {}", path, e);
        }
    }
}
