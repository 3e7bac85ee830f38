package github.sarthakdev143.download_bot.integration.video;

import github.sarthakdev143.download_bot.config.DownloadBotProperties;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.integration.process.SubprocessRunner;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.FetchedMedia;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.service.MediaTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FfmpegTranscoder implements MediaTranscoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegTranscoder.class);
    static final String LOG_FILE_NAME = "ffmpeg.log";
    private static final String OUTPUT_FILE_BASE = "output.";
    private static final int DIAGNOSTIC_TAIL_CHARS = 600;
    private static final long BYTES_PER_MEGABYTE = 1024L * 1024L;
    private static final List<String> UNSUPPORTED_CODEC_MARKERS = List.of(
            "unknown encoder",
            "encoder not found",
            "decoder not found",
            "does not contain any stream",
            "invalid data found when processing input");

    private final DownloadBotProperties properties;
    private final SubprocessRunner subprocessRunner;

    public FfmpegTranscoder(DownloadBotProperties properties, SubprocessRunner subprocessRunner) {
        this.properties = properties;
        this.subprocessRunner = subprocessRunner;
    }

    @Override
    public Path transcode(FetchedMedia media, OutputPreset preset, Path stagingDirectory) throws MediaPipelineException {
        Path rawInput = media.file();
        Path audioInput = media.audioFile();
        long inputBytes = stagedSize(rawInput);
        if (audioInput != null) {
            inputBytes += stagedSize(audioInput);
        }

        Path outputPath = stagingDirectory.resolve(OUTPUT_FILE_BASE + preset.fileExtension());
        Path logPath = stagingDirectory.resolve(LOG_FILE_NAME);
        List<String> command = buildCommand(
                preset,
                inputArgument(rawInput, stagingDirectory),
                audioInput == null ? null : inputArgument(audioInput, stagingDirectory),
                outputPath.getFileName().toString());
        Duration timeout = timeoutFor(inputBytes);

        logger.info("Running FFmpeg for preset {} with timeout {}: {}", preset.presetName(), timeout, String.join(" ", command));
        SubprocessRunner.Result result;
        try {
            result = subprocessRunner.run(command, stagingDirectory, logPath, null, timeout);
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.TOOLCHAIN_ERROR, "FFmpeg could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteIfExists(outputPath);
            throw new MediaPipelineException(FailureKind.CANCELLED, "Transcoding was interrupted.", e);
        }

        if (result.timedOut()) {
            deleteIfExists(outputPath);
            throw new MediaPipelineException(FailureKind.TIMEOUT, "FFmpeg exceeded its time limit of " + timeout.toSeconds() + "s.");
        }

        if (result.exitCode() != 0) {
            deleteIfExists(outputPath);
            String diagnostics = SubprocessRunner.tail(logPath, DIAGNOSTIC_TAIL_CHARS);
            FailureKind kind = classifyFailure(diagnostics);
            throw new MediaPipelineException(kind, "FFmpeg exited with code " + result.exitCode() + ". Output: " + diagnostics);
        }

        if (!hasContent(outputPath)) {
            deleteIfExists(outputPath);
            throw new MediaPipelineException(FailureKind.TOOLCHAIN_ERROR, "FFmpeg produced no output.");
        }
        return outputPath;
    }

    List<String> buildCommand(OutputPreset preset, String inputFile, String outputFile) {
        return buildCommand(preset, inputFile, null, outputFile);
    }

    /**
     * Full FFmpeg argument list. File names are relative to the staging directory the process
     * runs in. A separate audio track, when present, is the second input and supplies the sound.
     */
    List<String> buildCommand(OutputPreset preset, String inputFile, String audioTrackFile, String outputFile) {
        List<String> command = new ArrayList<>();
        command.add(properties.resolveFfmpegBinary());
        command.add("-hide_banner");
        command.add("-nostdin");
        command.add("-y");
        command.add("-i");
        command.add(inputFile);
        if (audioTrackFile != null) {
            command.add("-i");
            command.add(audioTrackFile);
        }
        command.addAll(presetArguments(preset, audioTrackFile != null));
        command.add(outputFile);
        return command;
    }

    List<String> presetArguments(OutputPreset preset, boolean separateAudioTrack) {
        String audioMap = separateAudioTrack ? "1:a:0" : "0:a:0";
        // a muxed source may legitimately have no sound
        String videoAudioMap = separateAudioTrack ? audioMap : "0:a:0?";
        return switch (preset) {
            case AUDIO_MP3_128K -> mp3Arguments("128k", audioMap);
            case AUDIO_MP3_192K -> mp3Arguments("192k", audioMap);
            case AUDIO_MP3_320K -> mp3Arguments("320k", audioMap);
            case AUDIO_M4A_AAC_192K -> List.of(
                    "-vn",
                    "-map",
                    audioMap,
                    "-c:a",
                    "aac",
                    "-b:a",
                    "192k",
                    "-movflags",
                    "+faststart",
                    "-f",
                    "ipod");
            case VIDEO_H264_1080P -> h264Arguments(1080, videoAudioMap);
            case VIDEO_H264_720P -> h264Arguments(720, videoAudioMap);
            case VIDEO_H264_480P -> h264Arguments(480, videoAudioMap);
        };
    }

    Duration timeoutFor(long inputBytes) {
        long megabytes = Math.max(1L, (inputBytes + BYTES_PER_MEGABYTE - 1) / BYTES_PER_MEGABYTE);
        Duration proportional = properties.getTranscodeBaseTimeout()
                .plus(properties.getTranscodeTimeoutPerMegabyte().multipliedBy(megabytes));
        Duration cap = properties.getTranscodeMaxTimeout();
        return proportional.compareTo(cap) > 0 ? cap : proportional;
    }

    FailureKind classifyFailure(String diagnostics) {
        String normalized = diagnostics.toLowerCase(Locale.ROOT);
        for (String marker : UNSUPPORTED_CODEC_MARKERS) {
            if (normalized.contains(marker)) {
                return FailureKind.UNSUPPORTED_CODEC;
            }
        }
        return FailureKind.TOOLCHAIN_ERROR;
    }

    private List<String> mp3Arguments(String bitrate, String audioMap) {
        return List.of(
                "-vn",
                "-map",
                audioMap,
                "-c:a",
                "libmp3lame",
                "-b:a",
                bitrate,
                "-f",
                "mp3");
    }

    private List<String> h264Arguments(int maxHeight, String audioMap) {
        return List.of(
                "-map",
                "0:v:0",
                "-map",
                audioMap,
                "-vf",
                "scale=-2:'min(" + maxHeight + ",ih)'",
                "-c:v",
                "libx264",
                "-preset",
                "veryfast",
                "-crf",
                "23",
                "-pix_fmt",
                "yuv420p",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-movflags",
                "+faststart",
                "-f",
                "mp4");
    }

    private long stagedSize(Path input) throws MediaPipelineException {
        if (!Files.isRegularFile(input)) {
            throw new MediaPipelineException(FailureKind.TOOLCHAIN_ERROR, "Staged input is missing: " + input.getFileName());
        }
        try {
            return Files.size(input);
        } catch (IOException e) {
            throw new MediaPipelineException(FailureKind.TOOLCHAIN_ERROR, "Staged input is unreadable.", e);
        }
    }

    private String inputArgument(Path rawInput, Path stagingDirectory) {
        Path absoluteInput = rawInput.toAbsolutePath().normalize();
        Path absoluteStaging = stagingDirectory.toAbsolutePath().normalize();
        if (absoluteInput.startsWith(absoluteStaging)) {
            return absoluteStaging.relativize(absoluteInput).toString();
        }
        return absoluteInput.toString();
    }

    private boolean hasContent(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete partial output {}", path, e);
        }
    }
}
