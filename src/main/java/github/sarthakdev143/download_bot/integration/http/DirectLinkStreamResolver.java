package github.sarthakdev143.download_bot.integration.http;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
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
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handles URLs that already point at a media file ({@code https://host/clip.mp4}).
 */
@Component
@Order(1)
public class DirectLinkStreamResolver implements StreamResolver {

    private static final Logger logger = LoggerFactory.getLogger(DirectLinkStreamResolver.class);
    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "m4v", "mov", "mkv", "webm");
    private static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "m4a", "aac", "ogg", "opus", "wav", "flac");

    private final HttpRequestFactory requestFactory;
    private final DownloadBotProperties properties;

    public DirectLinkStreamResolver(HttpRequestFactory requestFactory, DownloadBotProperties properties) {
        this.requestFactory = requestFactory;
        this.properties = properties;
    }

    @Override
    public boolean supports(String sourceRef) {
        return SourceUrls.parseHttpUrl(sourceRef)
                .map(SourceUrls::extensionOf)
                .filter(extension -> VIDEO_EXTENSIONS.contains(extension) || AUDIO_EXTENSIONS.contains(extension))
                .isPresent();
    }

    @Override
    public ResolvedMedia resolve(String sourceRef, OutputPreset preset) throws MediaPipelineException {
        URI uri = SourceUrls.parseHttpUrl(sourceRef)
                .orElseThrow(() -> new MediaPipelineException(FailureKind.RESOLVE_ERROR, "Not an http(s) URL."));
        String extension = SourceUrls.extensionOf(uri);
        boolean video = VIDEO_EXTENSIONS.contains(extension);
        if (preset.video() && !video) {
            throw new MediaPipelineException(FailureKind.UNSUPPORTED_FORMAT,
                    "An audio file cannot be converted to the video preset " + preset.presetName() + ".");
        }

        StreamCandidate candidate = new StreamCandidate(
                uri.toString(),
                extension,
                video,
                true,
                null,
                headContentLength(uri).orElse(null));
        return new ResolvedMedia(SourceUrls.baseNameOf(uri), SourcePlatform.detect(sourceRef), List.of(candidate));
    }

    private Optional<Long> headContentLength(URI uri) throws MediaPipelineException {
        HttpResponse response = null;
        try {
            HttpRequest request = requestFactory.buildHeadRequest(new GenericUrl(uri));
            request.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
            request.setReadTimeout((int) properties.getReadTimeout().toMillis());
            request.setNumberOfRetries(0);
            response = request.execute();
            return Optional.ofNullable(response.getHeaders().getContentLength());
        } catch (HttpResponseException e) {
            // HEAD only supplies the size, GET decides whether the stream exists
            if (!HttpFailures.isTransient(e.getStatusCode())) {
                logger.debug("HEAD answered {} for {}; size will not be verified", e.getStatusCode(), uri);
                return Optional.empty();
            }
            throw HttpFailures.classify(e, "Source answered HTTP " + e.getStatusCode() + ".");
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.NETWORK_ERROR, "Could not reach source: " + e.getMessage(), e);
        } finally {
            HttpFailures.disconnectQuietly(response);
        }
    }
}
