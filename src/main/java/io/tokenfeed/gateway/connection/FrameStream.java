package io.tokenfeed.gateway.connection;

import java.util.Iterator;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Inbound frames of a {@link FeedConnection}, in arrival order, across reconnects.
 * {@link #hasNext()} blocks until a frame arrives or the stream is terminated.
 * Frames queued before termination are still delivered. Intended for a single reader.
 */
public final class FrameStream implements Iterator<String> {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile ConnectionClosedException terminationCause;

    // Reader-thread state
    private String lookahead;
    private boolean ended;

    FrameStream() {
    }

    void offer(String frame) {
        if (!terminated.get()) {
            queue.offer(frame);
        }
    }

    void terminate(ConnectionClosedException cause) {
        if (terminated.compareAndSet(false, true)) {
            terminationCause = cause;
            queue.offer(END);
        }
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Returns why the stream ended, or null while it is still open.
     */
    public ConnectionClosedException getTerminationCause() {
        return terminationCause;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        Object item;
        try {
            item = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (item == END) {
            ended = true;
            return false;
        }
        lookahead = (String) item;
        return true;
    }

    /**
     * Returns the next frame.
     *
     * @throws ConnectionClosedException if the stream has ended
     */
    @Override
    public String next() {
        if (!hasNext()) {
            ConnectionClosedException cause = terminationCause;
            throw cause != null ? cause : new ConnectionClosedException("Frame stream ended");
        }
        String frame = lookahead;
        lookahead = null;
        return frame;
    }
}
