package github.sarthakdev143.download_bot.service;

import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.ResolvedMedia;

public interface StreamResolver {

    boolean supports(String sourceRef);

    ResolvedMedia resolve(String sourceRef, OutputPreset preset) throws MediaPipelineException;
}
