package io.relaybroker.broker.topic;

import io.relaybroker.backend.BackendQueue;
import io.relaybroker.broker.channel.Channel;
import io.relaybroker.broker.channel.ChannelFactory;
import io.relaybroker.broker.delivery.Delivery;
import io.relaybroker.core.barrier.Barrier;
import io.relaybroker.core.model.CorruptMessageException;
import io.relaybroker.core.model.Message;
import io.relaybroker.core.model.MessageCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A named message stream fanned out to every registered {@link Channel}.
 * <p>
 * Two loops run per topic:
 * <ul>
 *   <li>the <b>router</b> takes producer messages off the ingest buffer and places each one in the
 *   bounded memory buffer, or, when that is full, encodes it into the {@link BackendQueue};</li>
 *   <li>the <b>pump</b>, started with the first channel, drains memory and backend and hands every
 *   channel its own copy of each message through that channel's {@link Delivery}.</li>
 * </ul>
 * Both loops stop when the topic's {@link Barrier} is alerted by {@link #close()}. Neither drains
 * its input on the way out.
 * </p>
 * <p>
 * Each delivery holds at most {@link TopicSettings#channelBacklog()} messages. While any of them
 * is full the pump takes nothing, so the memory buffer fills and the router spills to the backend.
 * </p>
 */
@Slf4j
public final class Topic implements AutoCloseable {

    /* Consecutive memory messages the pump takes before giving the backend a turn. */
    static final int MAX_MEMORY_STREAK = 64;

    private static final long POLL_MILLIS = 10;
    private static final long IDLE_MILLIS = 50;
    /* Shared by every wait in close(). */
    static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    @Getter private final String name;
    @Getter private final TopicSettings settings;

    private final BackendQueue backend;
    private final ChannelFactory channelFactory;
    private final MessageCodec codec;

    private final BlockingQueue<Message> incoming;
    private final BlockingQueue<Message> memory;
    private final Barrier barrier = new Barrier();

    /* channel name -> delivery; guarded by channelLock, as is pumpStarted */
    private final Map<String, Delivery> deliveries = new HashMap<>();
    private final ReadWriteLock channelLock = new ReentrantReadWriteLock();
    private boolean pumpStarted;

    private final ExecutorService routerExecutor;
    private final ExecutorService pumpExecutor;
    private final ExecutorService deliveryPool;

    private final AtomicBoolean closing = new AtomicBoolean();
    private volatile boolean closed;

    private final LongAdder messageCount = new LongAdder();
    private final LongAdder droppedCount = new LongAdder();

    private Topic(final String name,
                  final TopicSettings settings,
                  final BackendQueue backend,
                  final ChannelFactory channelFactory) {
        this.name = Objects.requireNonNull(name, "name");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.codec = new MessageCodec(settings.maxMessageSize());

        this.incoming = new ArrayBlockingQueue<>(settings.ingestQueueSize());
        this.memory = settings.memQueueSize() == 0
                ? new SynchronousQueue<>()
                : new ArrayBlockingQueue<>(settings.memQueueSize());

        this.routerExecutor = Executors.newSingleThreadExecutor(named("topic-" + name + "-router"));
        this.pumpExecutor = Executors.newSingleThreadExecutor(named("topic-" + name + "-pump"));
        this.deliveryPool = Executors.newFixedThreadPool(settings.deliveryThreads(), named("topic-" + name + "-delivery"));
    }

    /**
     * Creates a topic and starts its router. The pump starts with the first {@link #getChannel}.
     */
    public static Topic create(final String name,
                               final TopicSettings settings,
                               final BackendQueue backend,
                               final ChannelFactory channelFactory) {
        final Topic topic = new Topic(name, settings, backend, channelFactory);
        topic.routerExecutor.submit(topic::routerLoop);
        log.info("TOPIC({}): created (memQueueSize={})", name, settings.memQueueSize());
        return topic;
    }

    /**
     * Returns the channel called {@code channelName}, creating and registering it on first use.
     * The first channel of the topic also starts the pump.
     */
    public Channel getChannel(final String channelName) {
        Objects.requireNonNull(channelName, "channelName");

        channelLock.writeLock().lock();
        try {
            if (closing.get()) throw new IllegalStateException("topic " + name + " is closed");

            Delivery delivery = deliveries.get(channelName);
            if (delivery == null) {
                final Channel channel = channelFactory.create(name, channelName);
                delivery = new Delivery(channel, deliveryPool, settings.channelBacklog());
                deliveries.put(channelName, delivery);
                log.info("TOPIC({}): new channel({})", name, channelName);
            }

            if (!pumpStarted) {
                // close() flips closing under this lock, so the executor is still running here
                pumpStarted = true;
                pumpExecutor.submit(this::pumpLoop);
                log.info("TOPIC({}): message pump started", name);
            }

            return delivery.getChannel();
        } finally {
            channelLock.writeLock().unlock();
        }
    }

    /**
     * Snapshot of the registered channels.
     */
    public List<Channel> getChannels() {
        channelLock.readLock().lock();
        try {
            final List<Channel> channels = new ArrayList<>(deliveries.size());
            for (final Delivery delivery : deliveries.values()) {
                channels.add(delivery.getChannel());
            }
            return channels;
        } finally {
            channelLock.readLock().unlock();
        }
    }

    /**
     * Queue a message for routing. Blocks while the ingest buffer is full.
     *
     * @throws IllegalStateException if the topic is closing or closed
     */
    public void putMessage(final Message message) throws InterruptedException {
        Objects.requireNonNull(message, "message");

        while (true) {
            if (closing.get()) throw new IllegalStateException("topic " + name + " is closed");
            if (incoming.offer(message, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                messageCount.increment();
                return;
            }
        }
    }

    public int memoryDepth() {
        return memory.size();
    }

    public long backendDepth() {
        return backend.depth();
    }

    /**
     * Messages routed but not yet picked up by the pump.
     */
    public long depth() {
        return memoryDepth() + backendDepth();
    }

    /**
     * Messages accepted by {@link #putMessage}.
     */
    public long messageCount() {
        return messageCount.sum();
    }

    /**
     * Messages the router gave up on because they could not be encoded or stored.
     */
    public long droppedCount() {
        return droppedCount.sum();
    }

    /**
     * Messages handed to channel deliveries but not yet to the channels themselves.
     */
    public long backlog() {
        channelLock.readLock().lock();
        try {
            long total = 0;
            for (final Delivery delivery : deliveries.values()) {
                total += delivery.backlog();
            }
            return total;
        } finally {
            channelLock.readLock().unlock();
        }
    }

    public boolean isPumpStarted() {
        channelLock.readLock().lock();
        try {
            return pumpStarted;
        } finally {
            channelLock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops both loops, closes every channel and then the backend queue.
     * <p>
     * Channel close failures are logged and do not stop the remaining channels from closing.
     * A backend close failure is rethrown. Closing a topic twice fails. Router, pump and pending
     * deliveries together get {@value #SHUTDOWN_TIMEOUT_MILLIS} ms before they are interrupted.
     * </p>
     */
    @Override
    public void close() throws IOException {
        channelLock.writeLock().lock();
        try {
            if (!closing.compareAndSet(false, true)) {
                throw new IOException("topic " + name + " already closed");
            }
        } finally {
            channelLock.writeLock().unlock();
        }
        log.info("TOPIC({}): closing", name);

        barrier.alert();
        routerExecutor.shutdown();
        pumpExecutor.shutdown();
        deliveryPool.shutdown();

        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(SHUTDOWN_TIMEOUT_MILLIS);
        stop(routerExecutor, "router", deadline);
        stop(pumpExecutor, "pump", deadline);
        stop(deliveryPool, "delivery", deadline);

        final List<Channel> channels = getChannels();
        for (final Channel channel : channels) {
            try {
                channel.close();
            } catch (final IOException | RuntimeException e) {
                // keep going so every channel gets a close attempt
                log.error("TOPIC({}): channel({}) close failed", name, channel.getName(), e);
            }
        }

        try {
            backend.close();
        } finally {
            closed = true;
            log.info("TOPIC({}): closed", name);
        }
    }

    private void routerLoop() {
        try {
            while (!barrier.isAlerted()) {
                final Message message = incoming.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    route(message);
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final RuntimeException e) {
            log.error("TOPIC({}): router failed", name, e);
        }
        log.debug("TOPIC({}): router exiting", name);
    }

    /*
     * Memory if there is room, otherwise the backend queue. Never both.
     */
    private void route(final Message message) {
        if (memory.offer(message)) {
            barrier.signal();
            return;
        }

        final byte[] data;
        try {
            data = codec.encode(message);
        } catch (final IOException e) {
            droppedCount.increment();
            log.error("TOPIC({}): failed to encode {}, dropping it", name, message, e);
            return;
        }

        try {
            backend.put(data);
        } catch (final IOException e) {
            droppedCount.increment();
            log.error("TOPIC({}): backend put failed, dropping {}", name, message, e);
            return;
        }
        barrier.signal();
    }

    private void pumpLoop() {
        int memoryStreak = 0;
        try {
            while (!barrier.isAlerted()) {
                if (!deliveriesHaveRoom()) {
                    // leave the message where it is until the slowest channel catches up
                    barrier.block(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    continue;
                }

                Message message = null;

                if (memoryStreak >= MAX_MEMORY_STREAK) {
                    memoryStreak = 0;
                    message = readBackend();
                }
                if (message == null) {
                    message = memory.poll();
                    if (message != null) {
                        memoryStreak++;
                    } else {
                        memoryStreak = 0;
                        message = readBackend();
                    }
                }

                if (message == null) {
                    barrier.block(IDLE_MILLIS, TimeUnit.MILLISECONDS);
                    continue;
                }

                fanOut(message);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final RuntimeException e) {
            log.error("TOPIC({}): message pump failed", name, e);
        }
        log.debug("TOPIC({}): message pump exiting", name);
    }

    /*
     * Next decodable backend record, skipping malformed ones. Null when the backend has nothing.
     */
    private Message readBackend() {
        while (true) {
            final byte[] data;
            try {
                data = backend.poll();
            } catch (final IOException e) {
                log.error("TOPIC({}): backend read failed", name, e);
                return null;
            }
            if (data == null) {
                return null;
            }

            try {
                return codec.decode(data);
            } catch (final CorruptMessageException e) {
                log.error("TOPIC({}): failed to decode message - {}", name, e.getMessage());
            }
        }
    }

    private boolean deliveriesHaveRoom() {
        channelLock.readLock().lock();
        try {
            for (final Delivery delivery : deliveries.values()) {
                if (!delivery.hasRoom()) return false;
            }
            return true;
        } finally {
            channelLock.readLock().unlock();
        }
    }

    /*
     * Only the pump dispatches, and it checked for room first, so every dispatch here is accepted.
     */
    private void fanOut(final Message message) {
        channelLock.readLock().lock();
        try {
            for (final Delivery delivery : deliveries.values()) {
                // each channel gets its own instance
                if (!delivery.dispatch(message.copy())) {
                    log.warn("TOPIC({}): channel({}) backlog full, {} not delivered to it",
                            name, delivery.getChannel().getName(), message);
                }
            }
        } finally {
            channelLock.readLock().unlock();
        }
    }

    private void stop(final ExecutorService executor, final String what, final long deadlineNanos) {
        try {
            final long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            if (!executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                log.warn("TOPIC({}): {} did not stop within {} ms, interrupting", name, what, SHUTDOWN_TIMEOUT_MILLIS);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
