package io.relaybroker.broker.channel;

import io.relaybroker.core.model.Message;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-memory channel.
 * <p>
 * {@link #putMessage(Message)} blocks while the queue is full; the topic calls it from the
 * channel's delivery worker, so only this channel's backlog waits. Consumers pull with
 * {@link #poll(long, TimeUnit)}, which counts a delivery attempt on the message.
 * </p>
 */
@Slf4j
public final class QueueChannel implements Channel {

    @Getter private final String topicName;
    @Getter private final String name;
    private final BlockingQueue<Message> queue;

    private volatile boolean closed;

    public QueueChannel(final String topicName, final String name, final int capacity) {
        this.topicName = Objects.requireNonNull(topicName, "topicName");
        this.name = Objects.requireNonNull(name, "name");
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public static ChannelFactory factory(final int capacity) {
        return (topicName, channelName) -> new QueueChannel(topicName, channelName, capacity);
    }

    @Override
    public void putMessage(final Message message) {
        if (closed) {
            log.warn("CHANNEL({}.{}): closed, dropping {}", topicName, name, message);
            return;
        }
        try {
            queue.put(message);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("CHANNEL({}.{}): interrupted while queueing {}", topicName, name, message);
        }
    }

    /**
     * Next message, waiting up to {@code timeout}.
     *
     * @return the message, or {@code null} if none arrived in time
     */
    public Message poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        final Message message = queue.poll(timeout, unit);
        if (message != null) {
            message.incrementAttempts();
        }
        return message;
    }

    public int depth() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) throw new IOException("channel " + topicName + "." + name + " already closed");
        closed = true;

        final int remaining = queue.size();
        log.info("CHANNEL({}.{}): closing with {} undelivered messages", topicName, name, remaining);
    }
}
