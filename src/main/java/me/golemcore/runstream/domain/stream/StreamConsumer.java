package me.golemcore.runstream.domain.stream;

import me.golemcore.runstream.domain.model.StreamEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One attached push-stream reader. Events are queued by the multiplexer and
 * drained by the transport at its own pace. Once closed the consumer accepts
 * nothing and its queue is empty.
 */
public class StreamConsumer {

    private final String id = UUID.randomUUID().toString();
    private final String conversationId;
    private final BlockingQueue<StreamEvent> queue;
    private volatile boolean closed;

    StreamConsumer(String conversationId, int capacity) {
        this.conversationId = conversationId;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
    }

    public String getId() {
        return id;
    }

    public String getConversationId() {
        return conversationId;
    }

    boolean offer(StreamEvent event) {
        if (closed) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Removes and returns everything queued so far, in sequence order.
     */
    public List<StreamEvent> drain() {
        List<StreamEvent> batch = new ArrayList<>(queue.size());
        queue.drainTo(batch);
        return batch;
    }

    /**
     * Waits up to {@code timeoutMs} for the next event.
     *
     * @return the event, or null on timeout
     */
    public StreamEvent poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
        queue.clear();
    }
}
