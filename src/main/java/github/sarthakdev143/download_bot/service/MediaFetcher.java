package github.sarthakdev143.download_bot.service;

import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.model.FetchedMedia;
import github.sarthakdev143.download_bot.model.OutputPreset;

import java.nio.file.Path;

public interface MediaFetcher {

    FetchedMedia fetch(String sourceRef, OutputPreset preset, Path stagingDirectory) throws MediaPipelineException;
}
