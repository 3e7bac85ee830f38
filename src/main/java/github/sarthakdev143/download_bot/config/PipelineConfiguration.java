package github.sarthakdev143.download_bot.config;

import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import github.sarthakdev143.download_bot.pipeline.DownloadJobQueue;
import github.sarthakdev143.download_bot.pipeline.DownloadPipeline;
import github.sarthakdev143.download_bot.pipeline.JobStatusRegistry;
import github.sarthakdev143.download_bot.pipeline.ResultSink;
import github.sarthakdev143.download_bot.pipeline.StagingArea;
import github.sarthakdev143.download_bot.service.DeliveryCallback;
import github.sarthakdev143.download_bot.service.MediaFetcher;
import github.sarthakdev143.download_bot.service.MediaTranscoder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DownloadBotProperties.class)
public class PipelineConfiguration {

    @Bean
    public HttpTransport httpTransport() {
        return new NetHttpTransport();
    }

    @Bean
    public HttpRequestFactory httpRequestFactory(HttpTransport httpTransport) {
        return httpTransport.createRequestFactory();
    }

    @Bean
    public StagingArea stagingArea(DownloadBotProperties properties) {
        return new StagingArea(Path.of(properties.getStagingRoot()));
    }

    @Bean
    public JobStatusRegistry jobStatusRegistry(DownloadBotProperties properties) {
        return new JobStatusRegistry(properties.getStatusRetention(), Clock.systemUTC());
    }

    @Bean
    public DownloadJobQueue downloadJobQueue(DownloadBotProperties properties) {
        return new DownloadJobQueue(properties.getQueueCapacity());
    }

    @Bean
    public ResultSink resultSink(DeliveryCallback deliveryCallback, StagingArea stagingArea) {
        return new ResultSink(deliveryCallback, stagingArea);
    }

    @Bean(initMethod = "start", destroyMethod = "drainAndStop")
    public DownloadPipeline downloadPipeline(
            DownloadJobQueue queue,
            MediaFetcher fetcher,
            MediaTranscoder transcoder,
            ResultSink resultSink,
            StagingArea stagingArea,
            JobStatusRegistry statusRegistry,
            MeterRegistry meterRegistry,
            DownloadBotProperties properties) {
        return new DownloadPipeline(
                queue,
                fetcher,
                transcoder,
                resultSink,
                stagingArea,
                statusRegistry,
                meterRegistry,
                properties);
    }
}
