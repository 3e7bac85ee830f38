package github.sarthakdev143.download_bot.dto;

import github.sarthakdev143.download_bot.model.DownloadJobState;

public record DownloadJobSubmissionResponse(
        String jobId,
        DownloadJobState state,
        String message) {
}
