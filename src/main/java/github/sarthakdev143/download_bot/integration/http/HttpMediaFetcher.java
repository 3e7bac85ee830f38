package github.sarthakdev143.download_bot.integration.http;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.FetchedMedia;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.ResolvedMedia;
import github.sarthakdev143.download_bot.model.StreamCandidate;
import github.sarthakdev143.download_bot.service.MediaFetcher;
import github.sarthakdev143.download_bot.service.StreamResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class HttpMediaFetcher implements MediaFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpMediaFetcher.class);
    private static final int MAX_CANDIDATES_TRIED = 3;
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final String RAW_FILE_BASE = "source.";
    private static final String AUDIO_TRACK_FILE_BASE = "source-audio.";
    private static final String FALLBACK_EXTENSION = "bin";
    private static final Pattern SAFE_EXTENSION = Pattern.compile("^[a-z0-9]{1,5}$");
    private static final List<String> ACCEPTED_CONTENT_TYPE_PREFIXES = List.of(
            "video/",
            "audio/",
            "application/octet-stream",
            "binary/octet-stream",
            "application/mp4",
            "application/ogg");

    private final List<StreamResolver> resolvers;
    private final HttpRequestFactory requestFactory;
    private final DownloadBotProperties properties;

    public HttpMediaFetcher(
            List<StreamResolver> resolvers,
            HttpRequestFactory requestFactory,
            DownloadBotProperties properties) {
        this.resolvers = List.copyOf(resolvers);
        this.requestFactory = requestFactory;
        this.properties = properties;
    }

    @Override
    public FetchedMedia fetch(String sourceRef, OutputPreset preset, Path stagingDirectory) throws MediaPipelineException {
        StreamResolver resolver = resolvers.stream()
                .filter(candidate -> candidate.supports(sourceRef))
                .findFirst()
                .orElseThrow(() -> new MediaPipelineException(
                        FailureKind.RESOLVE_ERROR,
                        "Source reference is not a recognised media URL."));

        ResolvedMedia media = resolver.resolve(sourceRef, preset);
        List<StreamCandidate> candidates = media.candidates().stream()
                .filter(candidate -> suits(candidate, preset))
                .toList();
        if (candidates.isEmpty()) {
            throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                    "No downloadable streams found for preset " + preset.presetName() + ".");
        }
        logger.info("Resolved {} source '{}' to {} candidate stream(s) for {}",
                media.platform().displayName(), media.title(), candidates.size(), preset.presetName());

        MediaPipelineException lastFailure = null;
        for (int index = 0; index < Math.min(candidates.size(), MAX_CANDIDATES_TRIED); index++) {
            StreamCandidate candidate = candidates.get(index);
            try {
                return transferCandidate(candidate, media.title(), stagingDirectory);
            } catch (MediaPipelineException e) {
                if (e.isRetryable()) {
                    throw e;
                }
                logger.warn("Candidate {} of '{}' not usable ({}): {}", index + 1, media.title(), e.kind(), e.getMessage());
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    private FetchedMedia transferCandidate(StreamCandidate candidate, String title, Path stagingDirectory)
            throws MediaPipelineException {
        Path file = transfer(candidate, stagingDirectory.resolve(RAW_FILE_BASE + sanitizeExtension(candidate.extension())));
        Path audioFile = null;
        boolean completed = false;
        try {
            if (candidate.audioTrack() != null) {
                StreamCandidate track = candidate.audioTrack();
                audioFile = transfer(track, stagingDirectory.resolve(AUDIO_TRACK_FILE_BASE + sanitizeExtension(track.extension())));
            }
            long size = Files.size(file) + (audioFile == null ? 0L : Files.size(audioFile));
            completed = true;
            return new FetchedMedia(file, audioFile, title, size, candidate);
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.NETWORK_ERROR, "Could not inspect downloaded file.", e);
        } finally {
            if (!completed) {
                deleteIfExists(file);
            }
        }
    }

    Path transfer(StreamCandidate candidate, Path target) throws MediaPipelineException {
        HttpResponse response = null;
        boolean completed = false;
        try {
            HttpRequest request = requestFactory.buildGetRequest(new GenericUrl(candidate.uri()));
            request.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
            request.setReadTimeout((int) properties.getReadTimeout().toMillis());
            request.setNumberOfRetries(0);
            request.setResponseReturnRawInputStream(true);
            response = request.execute();

            verifyContentType(response.getContentType());
            Long declaredLength = response.getHeaders().getContentLength();
            long maxBytes = properties.getMaxDownloadBytes();
            if (declaredLength != null && declaredLength > maxBytes) {
                throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                        "Stream is larger than the " + maxBytes + " byte limit.");
            }

            long written;
            try (InputStream in = response.getContent();
                 OutputStream out = Files.newOutputStream(target)) {
                written = copyBounded(in, out, maxBytes);
            }

            verifyLength(written, declaredLength, "Content-Length");
            verifyLength(written, candidate.expectedSizeBytes(), "declared stream size");
            completed = true;
            return target;
        } catch (HttpResponseException e) {
            throw HttpFailures.classify(e, "Stream answered HTTP " + e.getStatusCode() + ".");
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.NETWORK_ERROR, "Transfer failed: " + e.getMessage(), e);
        } finally {
            HttpFailures.disconnectQuietly(response);
            if (!completed) {
                deleteIfExists(target);
            }
        }
    }

    static boolean suits(StreamCandidate candidate, OutputPreset preset) {
        return preset.video() ? candidate.hasVideo() : candidate.carriesAudio();
    }

    static String sanitizeExtension(String extension) {
        if (extension == null) {
            return FALLBACK_EXTENSION;
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        return SAFE_EXTENSION.matcher(normalized).matches() ? normalized : FALLBACK_EXTENSION;
    }

    private long copyBounded(InputStream in, OutputStream out, long maxBytes) throws IOException, MediaPipelineException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                        "Stream is larger than the " + maxBytes + " byte limit.");
            }
            out.write(buffer, 0, read);
        }
        return total;
    }

    private void verifyContentType(String contentType) throws MediaPipelineException {
        if (contentType == null || contentType.isBlank()) {
            return;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        boolean accepted = ACCEPTED_CONTENT_TYPE_PREFIXES.stream().anyMatch(normalized::startsWith);
        if (!accepted) {
            throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                    "Stream has unsupported content type " + contentType + ".");
        }
    }

    private void verifyLength(long written, Long expected, String source) throws MediaPipelineException {
        if (expected != null && expected > 0 && expected != written) {
            throw new MediaPipelineException(FailureKind.NETWORK_ERROR,
                    "Transfer incomplete: got " + written + " bytes, " + source + " says " + expected + ".");
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete partial download {}", path, e);
        }
    }
}
