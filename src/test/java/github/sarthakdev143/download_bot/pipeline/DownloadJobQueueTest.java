package github.sarthakdev143.download_bot.pipeline;

import github.sarthakdev143.download_bot.exception.QueueSaturatedException;
import github.sarthakdev143.download_bot.model.DownloadJob;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.RequesterContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadJobQueueTest {

    @Test
    void jobsLeaveInSubmissionOrder() throws InterruptedException {
        DownloadJobQueue queue = new DownloadJobQueue(10);
        DownloadJob first = job();
        DownloadJob second = job();
        DownloadJob third = job();
        queue.submit(first);
        queue.submit(second);
        queue.submit(third);

        assertThat(queue.take()).isEqualTo(first);
        assertThat(queue.take()).isEqualTo(second);
        assertThat(queue.take()).isEqualTo(third);
    }

    @Test
    void submitRejectsWhenFullWithoutBlocking() {
        DownloadJobQueue queue = new DownloadJobQueue(2);
        queue.submit(job());
        queue.submit(job());

        assertThatThrownBy(() -> queue.submit(job()))
                .isInstanceOf(QueueSaturatedException.class)
                .hasMessageContaining("capacity 2");
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void requeueIgnoresCapacityAndGoesToTheBack() throws InterruptedException {
        DownloadJobQueue queue = new DownloadJobQueue(1);
        DownloadJob waiting = job();
        DownloadJob retried = job().nextAttempt();
        queue.submit(waiting);

        queue.requeue(retried);

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.take()).isEqualTo(waiting);
        assertThat(queue.take()).isEqualTo(retried);
    }

    @Test
    void pollReturnsEmptyAfterTimeout() throws InterruptedException {
        DownloadJobQueue queue = new DownloadJobQueue(1);

        assertThat(queue.poll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void removeTakesOnlyTheMatchingJob() {
        DownloadJobQueue queue = new DownloadJobQueue(5);
        DownloadJob keep = job();
        DownloadJob cancel = job();
        queue.submit(keep);
        queue.submit(cancel);

        Optional<DownloadJob> removed = queue.remove(cancel.id());

        assertThat(removed).contains(cancel);
        assertThat(queue.remove(cancel.id())).isEmpty();
        assertThat(queue.closeAndDrain()).containsExactly(keep);
        assertThat(queue.size()).isZero();
    }

    @Test
    void closedQueueRefusesNewAndRetriedJobs() {
        DownloadJobQueue queue = new DownloadJobQueue(5);
        DownloadJob waiting = job();
        queue.submit(waiting);

        assertThat(queue.closeAndDrain()).containsExactly(waiting);

        assertThat(queue.isClosed()).isTrue();
        assertThatThrownBy(() -> queue.submit(job()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
        assertThat(queue.requeue(job().nextAttempt())).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new DownloadJobQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentConsumersReceiveEachJobExactlyOnce() throws InterruptedException {
        int jobCount = 200;
        DownloadJobQueue queue = new DownloadJobQueue(jobCount);
        Set<String> submitted = new HashSet<>();
        for (int i = 0; i < jobCount; i++) {
            submitted.add(queue.submit(job()));
        }

        List<String> received = Collections.synchronizedList(new ArrayList<>());
        ExecutorService consumers = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int i = 0; i < 4; i++) {
            consumers.execute(() -> {
                try {
                    Optional<DownloadJob> next;
                    while ((next = queue.poll(Duration.ofMillis(50))).isPresent()) {
                        received.add(next.get().id());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        consumers.shutdownNow();
        assertThat(received).hasSize(jobCount).doesNotHaveDuplicates();
        assertThat(new HashSet<>(received)).isEqualTo(submitted);
    }

    private DownloadJob job() {
        return DownloadJob.create("https://example.com/clip.mp4", OutputPreset.AUDIO_MP3_192K, RequesterContext.of("tester"));
    }
}
