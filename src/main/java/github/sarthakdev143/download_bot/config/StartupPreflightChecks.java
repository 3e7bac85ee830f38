package github.sarthakdev143.download_bot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "download-bot.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int TOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final DownloadBotProperties properties;

    public StartupPreflightChecks(DownloadBotProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkStagingRoot();
        checkYtDlpAvailability();
    }

    private void checkFfmpegConfiguration() {
        String ffmpegBinary = properties.resolveFfmpegBinary();
        if (!answersVersion(ffmpegBinary, "-version")) {
            throw new IllegalStateException(
                    "FFmpeg is not available at '" + ffmpegBinary + "'. Install FFmpeg, set "
                            + "download-bot.ffmpeg-path or set FFMPEG_PATH.");
        }
    }

    private void checkStagingRoot() {
        Path stagingRoot = Path.of(properties.getStagingRoot()).toAbsolutePath();
        try {
            Files.createDirectories(stagingRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Staging root could not be created at " + stagingRoot + ".", e);
        }

        if (!Files.isWritable(stagingRoot)) {
            throw new IllegalStateException("Staging root is not writable at " + stagingRoot + ".");
        }
    }

    private void checkYtDlpAvailability() {
        String ytDlpBinary = properties.getYtDlpPath();
        if (!answersVersion(ytDlpBinary, "--version")) {
            logger.warn("yt-dlp is not available at '{}'; only direct media links can be downloaded.", ytDlpBinary);
        }
    }

    private boolean answersVersion(String binary, String versionFlag) {
        Process process = null;
        try {
            process = new ProcessBuilder(binary, versionFlag)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(TOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return finished && process.exitValue() == 0;
        } catch (IOException e) {
            logger.debug("Could not start {} {}", binary, versionFlag, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
