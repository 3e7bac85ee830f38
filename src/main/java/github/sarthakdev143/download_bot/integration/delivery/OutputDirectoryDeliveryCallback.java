package github.sarthakdev143.download_bot.integration.delivery;

import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.DeliveryException;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.MediaArtifact;
import github.sarthakdev143.download_bot.model.RequesterContext;
import github.sarthakdev143.download_bot.service.DeliveryCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Delivers finished media into a per-requester folder under {@code download-bot.output-root},
 * named after the media title. Existing files are never overwritten; a clash becomes
 * {@code title (1).mp3}, {@code title (2).mp3} and so on.
 */
@Component
public class OutputDirectoryDeliveryCallback implements DeliveryCallback {

    private static final Logger logger = LoggerFactory.getLogger(OutputDirectoryDeliveryCallback.class);
    private static final int MAX_TITLE_LENGTH = 120;
    private static final int MAX_NAME_ATTEMPTS = 1000;
    private static final String FALLBACK_TITLE = "media";
    private static final String FALLBACK_REQUESTER = "anonymous";
    private static final String PARTIAL_PREFIX = ".delivery-";
    private static final String PARTIAL_SUFFIX = ".part";

    private final Path outputRoot;

    public OutputDirectoryDeliveryCallback(DownloadBotProperties properties) {
        this.outputRoot = Path.of(properties.getOutputRoot());
    }

    @Override
    public void onComplete(RequesterContext requesterContext, MediaArtifact artifact) throws DeliveryException {
        Path requesterDirectory = outputRoot.resolve(sanitizeRequesterId(requesterContext.requesterId()));
        String baseName = sanitizeTitle(artifact.title());
        String extension = artifact.preset().fileExtension();

        try {
            Files.createDirectories(requesterDirectory);
            Path delivered = copyToUniqueName(artifact.file(), requesterDirectory, baseName, extension);
            logger.info("Delivered {} ({} bytes) to {}", artifact.preset().presetName(), artifact.sizeBytes(), delivered);
        } catch (IOException e) {
            throw new DeliveryException("Could not write artifact to " + requesterDirectory + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void onFailure(RequesterContext requesterContext, FailureKind failureKind, String detail) {
        logger.warn("Download for requester {} failed ({}): {}", requesterContext.requesterId(), failureKind, detail);
    }

    static String sanitizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return FALLBACK_TITLE;
        }

        StringBuilder sanitized = new StringBuilder();
        for (char c : title.trim().toCharArray()) {
            boolean keep = Character.isLetterOrDigit(c) || c == ' ' || c == '.' || c == '_' || c == '-';
            sanitized.append(keep ? c : '_');
        }

        String result = sanitized.toString().trim();
        while (result.startsWith(".")) {
            result = result.substring(1);
        }
        if (result.length() > MAX_TITLE_LENGTH) {
            result = result.substring(0, MAX_TITLE_LENGTH).trim();
        }
        return result.isBlank() ? FALLBACK_TITLE : result;
    }

    static String sanitizeRequesterId(String requesterId) {
        if (requesterId == null || requesterId.isBlank()) {
            return FALLBACK_REQUESTER;
        }
        String sanitized = requesterId.trim().replaceAll("[^A-Za-z0-9_-]", "_");
        return sanitized.isBlank() ? FALLBACK_REQUESTER : sanitized;
    }

    private Path copyToUniqueName(Path source, Path directory, String baseName, String extension) throws IOException {
        // the artifact is copied in full under a hidden name first, so a failed copy never
        // leaves a truncated file under the title
        Path partial = directory.resolve(PARTIAL_PREFIX + UUID.randomUUID() + PARTIAL_SUFFIX);
        try {
            Files.copy(source, partial);
            Path target = reserveUniqueName(directory, baseName, extension);
            try {
                return Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                deleteLeftover(target);
                throw e;
            }
        } finally {
            deleteLeftover(partial);
        }
    }

    private Path reserveUniqueName(Path directory, String baseName, String extension) throws IOException {
        for (int counter = 0; counter < MAX_NAME_ATTEMPTS; counter++) {
            String fileName = counter == 0
                    ? baseName + "." + extension
                    : baseName + " (" + counter + ")." + extension;
            Path target = directory.resolve(fileName);
            try {
                return Files.createFile(target);
            } catch (FileAlreadyExistsException e) {
                logger.debug("{} already exists, trying next name", target);
            }
        }
        throw new IOException("No free file name for '" + baseName + "." + extension + "' in " + directory);
    }

    private void deleteLeftover(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete incomplete delivery {}", path, e);
        }
    }
}
