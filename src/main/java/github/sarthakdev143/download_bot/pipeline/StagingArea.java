package github.sarthakdev143.download_bot.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class StagingArea {

    private static final Logger logger = LoggerFactory.getLogger(StagingArea.class);
    private static final Pattern JOB_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,64}$");

    private final Path root;

    public StagingArea(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path directoryFor(String jobId) {
        if (jobId == null || !JOB_ID_PATTERN.matcher(jobId).matches()) {
            throw new IllegalArgumentException("Invalid job id for staging: " + jobId);
        }
        return root.resolve(jobId);
    }

    public Path create(String jobId) throws IOException {
        return Files.createDirectories(directoryFor(jobId));
    }

    public boolean exists(String jobId) {
        return Files.exists(directoryFor(jobId));
    }

    /**
     * Deletes everything staged for the job. Safe to call more than once.
     */
    public void release(String jobId) {
        Path directory = directoryFor(jobId);
        if (Files.notExists(directory)) {
            return;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::deleteIfExists);
        } catch (IOException e) {
            logger.warn("Could not walk staging directory {} for cleanup", directory, e);
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete staged file {}", path, e);
        }
    }
}
