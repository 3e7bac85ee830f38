package github.sarthakdev143.download_bot.service.impl;

import github.sarthakdev143.download_bot.exception.QueueSaturatedException;
import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.DownloadJobState;
import github.sarthakdev143.download_bot.model.DownloadJobStatus;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.RequesterContext;
import github.sarthakdev143.download_bot.pipeline.DownloadPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultDownloadServiceTest {

    @Mock
    private DownloadPipeline pipeline;

    private DefaultDownloadService service;

    @BeforeEach
    void setUp() {
        service = new DefaultDownloadService(pipeline);
    }

    @Test
    void submitBuildsFirstAttemptJobAndReturnsItsId() {
        when(pipeline.submit(any(DownloadJob.class))).thenAnswer(invocation -> ((DownloadJob) invocation.getArgument(0)).id());
        RequesterContext requester = new RequesterContext("chat-7", Map.of("chatId", "7"));

        String jobId = service.submit("  https://youtu.be/abc  ", "AUDIO-MP3-320K", requester);

        ArgumentCaptor<DownloadJob> jobCaptor = ArgumentCaptor.forClass(DownloadJob.class);
        verify(pipeline).submit(jobCaptor.capture());
        DownloadJob job = jobCaptor.getValue();
        assertThat(jobId).isEqualTo(job.id());
        assertThat(job.sourceRef()).isEqualTo("https://youtu.be/abc");
        assertThat(job.preset()).isEqualTo(OutputPreset.AUDIO_MP3_320K);
        assertThat(job.attemptCount()).isZero();
        assertThat(job.requesterContext()).isEqualTo(requester);
    }

    @Test
    void submitDefaultsMissingRequesterToAnonymous() {
        when(pipeline.submit(any(DownloadJob.class))).thenReturn("job-1");

        service.submit("https://youtu.be/abc", "video-h264-720p", null);

        ArgumentCaptor<DownloadJob> jobCaptor = ArgumentCaptor.forClass(DownloadJob.class);
        verify(pipeline).submit(jobCaptor.capture());
        assertThat(jobCaptor.getValue().requesterContext().requesterId()).isEqualTo("anonymous");
    }

    @Test
    void submitRejectsBlankSourceWithoutQueueing() {
        assertThatThrownBy(() -> service.submit(" ", "audio-mp3-128k", RequesterContext.of("u")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceRef");
        verifyNoInteractions(pipeline);
    }

    @Test
    void submitRejectsOverlongSource() {
        String longRef = "https://example.com/" + "a".repeat(2100);

        assertThatThrownBy(() -> service.submit(longRef, "audio-mp3-128k", RequesterContext.of("u")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(pipeline);
    }

    @Test
    void submitRejectsUnknownPreset() {
        assertThatThrownBy(() -> service.submit("https://youtu.be/abc", "gif-animated", RequesterContext.of("u")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("preset");
        verifyNoInteractions(pipeline);
    }

    @Test
    void submitPropagatesSaturation() {
        when(pipeline.submit(any(DownloadJob.class))).thenThrow(new QueueSaturatedException(100));

        assertThatThrownBy(() -> service.submit("https://youtu.be/abc", "audio-mp3-128k", RequesterContext.of("u")))
                .isInstanceOf(QueueSaturatedException.class);
    }

    @Test
    void statusAndCancelDelegateToPipeline() {
        Instant now = Instant.now();
        DownloadJobStatus status = new DownloadJobStatus(
                "job-1", DownloadJobState.FETCHING, "Fetching media.", now, now, OutputPreset.AUDIO_MP3_128K, 0, null, null);
        when(pipeline.status("job-1")).thenReturn(Optional.of(status));
        when(pipeline.cancel("job-1")).thenReturn(true);

        assertThat(service.getJobStatus("job-1")).contains(status);
        assertThat(service.cancel("job-1")).isTrue();
    }
}
