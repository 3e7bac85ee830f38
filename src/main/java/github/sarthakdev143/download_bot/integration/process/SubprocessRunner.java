package github.sarthakdev143.download_bot.integration.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools with a wall-clock limit. Output goes to files rather than pipes, so a
 * chatty process can never block on a full buffer while we wait for it.
 */
@Component
public class SubprocessRunner {

    private static final Logger logger = LoggerFactory.getLogger(SubprocessRunner.class);
    private static final long KILL_GRACE_SECONDS = 5;

    public record Result(int exitCode, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * @param stdoutFile receives standard output, and standard error too when {@code stderrFile} is null
     * @param stderrFile receives standard error, may be {@code null}
     */
    public Result run(
            List<String> command,
            Path workingDirectory,
            Path stdoutFile,
            Path stderrFile,
            Duration timeout) throws IOException, InterruptedException {
        logger.debug("Running {} in {}", command, workingDirectory);
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(stdoutFile.toFile());
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        if (stderrFile == null) {
            builder.redirectErrorStream(true);
        } else {
            builder.redirectError(stderrFile.toFile());
        }

        Process process = builder.start();
        process.getOutputStream().close();
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                logger.warn("Process {} exceeded {} and is being killed", command.get(0), timeout);
                killTree(process);
                return new Result(-1, true);
            }
            return new Result(process.exitValue(), false);
        } catch (InterruptedException e) {
            killTree(process);
            throw e;
        }
    }

    /**
     * Last {@code maxChars} characters of a log file, for diagnostics.
     */
    public static String tail(Path file, int maxChars) {
        if (file == null || Files.notExists(file)) {
            return "";
        }
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return content.length() <= maxChars ? content.trim() : content.substring(content.length() - maxChars).trim();
        } catch (IOException e) {
            logger.debug("Could not read process log {}", file, e);
            return "";
        }
    }

    private void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
