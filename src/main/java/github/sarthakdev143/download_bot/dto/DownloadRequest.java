package github.sarthakdev143.download_bot.dto;

import java.util.Map;

public record DownloadRequest(
        String sourceRef,
        String preset,
        String requesterId,
        Map<String, String> attributes) {
}
