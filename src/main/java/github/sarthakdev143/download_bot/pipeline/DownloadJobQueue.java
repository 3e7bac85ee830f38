package github.sarthakdev143.download_bot.pipeline;

import github.sarthakdev143.download_bot.exception.QueueSaturatedException;
import github.sarthakdev143.download_bot.model.DownloadJob;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO intake shared by the submission path and all workers. Every job handed out by
 * {@link #take()} or {@link #poll(Duration)} is removed under the lock, so it reaches exactly
 * one caller.
 */
public class DownloadJobQueue {

    private final int capacity;
    private final Deque<DownloadJob> jobs = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public DownloadJobQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1.");
        }
        this.capacity = capacity;
    }

    /**
     * Appends a new job without blocking.
     *
     * @throws QueueSaturatedException when {@code capacity} jobs are already waiting
     * @throws IllegalStateException    once the queue has been closed
     */
    public String submit(DownloadJob job) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Download queue is closed.");
            }
            if (jobs.size() >= capacity) {
                throw new QueueSaturatedException(capacity);
            }
            jobs.addLast(job);
            notEmpty.signal();
            return job.id();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a retried job at the back. Capacity is not enforced here: the job was already
     * accepted once and must not be lost.
     *
     * @return {@code false} when the queue is closed and the job was not added
     */
    public boolean requeue(DownloadJob job) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            jobs.addLast(job);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public DownloadJob take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (jobs.isEmpty()) {
                notEmpty.await();
            }
            return jobs.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public Optional<DownloadJob> poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (jobs.isEmpty()) {
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            return Optional.of(jobs.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public Optional<DownloadJob> remove(String jobId) {
        lock.lock();
        try {
            Iterator<DownloadJob> iterator = jobs.iterator();
            while (iterator.hasNext()) {
                DownloadJob job = iterator.next();
                if (job.id().equals(jobId)) {
                    iterator.remove();
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuses all further jobs and hands back whatever was still waiting.
     */
    public List<DownloadJob> closeAndDrain() {
        lock.lock();
        try {
            closed = true;
            List<DownloadJob> drained = new ArrayList<>(jobs);
            jobs.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
