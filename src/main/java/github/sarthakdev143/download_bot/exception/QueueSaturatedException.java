package github.sarthakdev143.download_bot.exception;

public class QueueSaturatedException extends RuntimeException {

    private final int capacity;

    public QueueSaturatedException(int capacity) {
        super("Download queue is full (capacity " + capacity + "). Try again later.");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
