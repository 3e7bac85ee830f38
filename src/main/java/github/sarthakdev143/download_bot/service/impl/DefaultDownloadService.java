package github.sarthakdev143.download_bot.service.impl;

import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.DownloadJobStatus;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.RequesterContext;
import github.sarthakdev143.download_bot.model.SourcePlatform;
import github.sarthakdev143.download_bot.pipeline.DownloadPipeline;
import github.sarthakdev143.download_bot.service.DownloadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class DefaultDownloadService implements DownloadService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadService.class);
    private static final int MAX_SOURCE_REF_LENGTH = 2048;

    private final DownloadPipeline pipeline;

    public DefaultDownloadService(DownloadPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public String submit(String sourceRef, String presetName, RequesterContext requesterContext) {
        String normalizedSourceRef = normalizeSourceRef(sourceRef);
        OutputPreset preset = OutputPreset.fromInput(presetName);
        RequesterContext context = requesterContext == null ? RequesterContext.of(null) : requesterContext;

        DownloadJob job = DownloadJob.create(normalizedSourceRef, preset, context);
        String jobId = pipeline.submit(job);
        logger.info(
                "Accepted download job {} platform={} preset={} requester={}",
                jobId,
                SourcePlatform.detect(normalizedSourceRef),
                preset.presetName(),
                context.requesterId());
        return jobId;
    }

    @Override
    public Optional<DownloadJobStatus> getJobStatus(String jobId) {
        return pipeline.status(jobId);
    }

    @Override
    public boolean cancel(String jobId) {
        return pipeline.cancel(jobId);
    }

    private String normalizeSourceRef(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("sourceRef is required.");
        }
        String normalized = sourceRef.trim();
        if (normalized.length() > MAX_SOURCE_REF_LENGTH) {
            throw new IllegalArgumentException("sourceRef must be at most " + MAX_SOURCE_REF_LENGTH + " characters.");
        }
        return normalized;
    }
}
