package io.relaybroker.broker.delivery;

import io.relaybroker.broker.channel.Channel;
import io.relaybroker.core.model.Message;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivery hands a topic's messages to one {@link Channel} off the fan-out thread.
 * <p>
 * {@link #dispatch(Message)} only enqueues; a drain task on the shared pool passes queued messages
 * to the channel one at a time, in dispatch order. At most one drain per channel runs at once, so
 * a slow channel holds back only its own backlog and one pool thread.
 * </p>
 * <p>
 * A drain hands over at most {@value #DRAIN_BATCH} messages before yielding its pool thread to
 * other channels.
 * </p>
 * <p>
 * The backlog is bounded. {@link #dispatch(Message)} refuses a message once the backlog is full;
 * callers check {@link #hasRoom()} first and hold the message back.
 * </p>
 */
@Slf4j
public final class Delivery {

    static final int DRAIN_BATCH = 256;

    /**
     * The channel this delivery feeds.
     */
    @Getter
    private final Channel channel;

    /**
     * Pool shared by every delivery of the owning topic.
     */
    private final Executor pool;

    private final BlockingQueue<Message> pending;
    private final AtomicBoolean scheduled = new AtomicBoolean();

    public Delivery(final Channel channel, final Executor pool, final int capacity) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.pool = Objects.requireNonNull(pool, "pool");
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.pending = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Queue {@code message} for the channel and return immediately.
     *
     * @return {@code false} if the backlog is full and the message was not queued
     */
    public boolean dispatch(final Message message) {
        if (!pending.offer(message)) {
            return false;
        }
        schedule();
        return true;
    }

    /**
     * Whether the backlog can take another message.
     */
    public boolean hasRoom() {
        return pending.remainingCapacity() > 0;
    }

    /**
     * Messages dispatched but not yet handed to the channel.
     */
    public int backlog() {
        return pending.size();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            pool.execute(this::drain);
        } catch (final RejectedExecutionException e) {
            scheduled.set(false);
            log.warn("DELIVERY({}): pool rejected drain, {} messages left undelivered", channel.getName(), pending.size());
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < DRAIN_BATCH; i++) {
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
                final Message message = pending.poll();
                if (message == null) {
                    return;
                }
                try {
                    channel.putMessage(message);
                } catch (final RuntimeException e) {
                    log.error("DELIVERY({}): putMessage failed for {}", channel.getName(), message, e);
                }
            }
        } finally {
            scheduled.set(false);
            // a dispatch may have raced with the end of this drain
            if (!pending.isEmpty() && !Thread.currentThread().isInterrupted()) {
                schedule();
            }
        }
    }
}
