package github.sarthakdev143.download_bot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "download-bot")
public class DownloadBotProperties {

    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";

    private int poolSize = 3;
    private int maxAttempts = 3;
    private int queueCapacity = 100;
    private String stagingRoot = Path.of(System.getProperty("java.io.tmpdir"), "download-bot", "staging").toString();
    private String outputRoot = "media";
    private String ffmpegPath;
    private String ytDlpPath = "yt-dlp";
    private Duration connectTimeout = Duration.ofSeconds(20);
    private Duration readTimeout = Duration.ofSeconds(60);
    private Duration resolveTimeout = Duration.ofSeconds(60);
    private long maxDownloadBytes = 2L * 1024 * 1024 * 1024;
    private Duration transcodeBaseTimeout = Duration.ofMinutes(2);
    private Duration transcodeTimeoutPerMegabyte = Duration.ofSeconds(2);
    private Duration transcodeMaxTimeout = Duration.ofMinutes(60);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Duration statusRetention = Duration.ofHours(1);
    private Duration workerPollInterval = Duration.ofMillis(500);

    public String resolveFfmpegBinary() {
        if (ffmpegPath != null && !ffmpegPath.isBlank()) {
            return ffmpegPath;
        }
        String fromEnvironment = System.getenv(FFMPEG_PATH_ENV);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return fromEnvironment;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("download-bot.pool-size must be at least 1.");
        }
        this.poolSize = poolSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("download-bot.max-attempts must be at least 1.");
        }
        this.maxAttempts = maxAttempts;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("download-bot.queue-capacity must be at least 1.");
        }
        this.queueCapacity = queueCapacity;
    }

    public String getStagingRoot() {
        return stagingRoot;
    }

    public void setStagingRoot(String stagingRoot) {
        this.stagingRoot = stagingRoot;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(String outputRoot) {
        this.outputRoot = outputRoot;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getYtDlpPath() {
        return ytDlpPath;
    }

    public void setYtDlpPath(String ytDlpPath) {
        this.ytDlpPath = ytDlpPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getResolveTimeout() {
        return resolveTimeout;
    }

    public void setResolveTimeout(Duration resolveTimeout) {
        this.resolveTimeout = resolveTimeout;
    }

    public long getMaxDownloadBytes() {
        return maxDownloadBytes;
    }

    public void setMaxDownloadBytes(long maxDownloadBytes) {
        this.maxDownloadBytes = maxDownloadBytes;
    }

    public Duration getTranscodeBaseTimeout() {
        return transcodeBaseTimeout;
    }

    public void setTranscodeBaseTimeout(Duration transcodeBaseTimeout) {
        this.transcodeBaseTimeout = transcodeBaseTimeout;
    }

    public Duration getTranscodeTimeoutPerMegabyte() {
        return transcodeTimeoutPerMegabyte;
    }

    public void setTranscodeTimeoutPerMegabyte(Duration transcodeTimeoutPerMegabyte) {
        this.transcodeTimeoutPerMegabyte = transcodeTimeoutPerMegabyte;
    }

    public Duration getTranscodeMaxTimeout() {
        return transcodeMaxTimeout;
    }

    public void setTranscodeMaxTimeout(Duration transcodeMaxTimeout) {
        this.transcodeMaxTimeout = transcodeMaxTimeout;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Duration getStatusRetention() {
        return statusRetention;
    }

    public void setStatusRetention(Duration statusRetention) {
        this.statusRetention = statusRetention;
    }

    public Duration getWorkerPollInterval() {
        return workerPollInterval;
    }

    public void setWorkerPollInterval(Duration workerPollInterval) {
        this.workerPollInterval = workerPollInterval;
    }
}
