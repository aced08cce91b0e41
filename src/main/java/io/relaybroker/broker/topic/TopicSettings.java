package io.relaybroker.broker.topic;

/**
 * Per-topic sizing.
 *
 * @param memQueueSize    capacity of the in-memory buffer; 0 sends every message to the backend queue
 * @param ingestQueueSize capacity of the producer-facing ingest buffer
 * @param maxMessageSize  largest body, in bytes, the topic will write to its backend queue
 * @param deliveryThreads size of the pool handing messages to channels
 * @param channelBacklog  messages a channel's delivery may hold before the pump stops taking new ones
 */
public record TopicSettings(int memQueueSize,
                            int ingestQueueSize,
                            int maxMessageSize,
                            int deliveryThreads,
                            int channelBacklog) {

    public static final int DEFAULT_MEM_QUEUE_SIZE = 10_000;
    public static final int DEFAULT_INGEST_QUEUE_SIZE = 5;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 1024 * 1024;
    public static final int DEFAULT_DELIVERY_THREADS = 4;
    public static final int DEFAULT_CHANNEL_BACKLOG = 1024;

    public TopicSettings {
        if (memQueueSize < 0) throw new IllegalArgumentException("memQueueSize must be >= 0");
        if (ingestQueueSize <= 0) throw new IllegalArgumentException("ingestQueueSize must be > 0");
        if (maxMessageSize <= 0) throw new IllegalArgumentException("maxMessageSize must be > 0");
        if (deliveryThreads <= 0) throw new IllegalArgumentException("deliveryThreads must be > 0");
        if (channelBacklog <= 0) throw new IllegalArgumentException("channelBacklog must be > 0");
    }

    public static TopicSettings defaults() {
        return withMemQueueSize(DEFAULT_MEM_QUEUE_SIZE);
    }

    public static TopicSettings withMemQueueSize(final int memQueueSize) {
        return new TopicSettings(memQueueSize, DEFAULT_INGEST_QUEUE_SIZE, DEFAULT_MAX_MESSAGE_SIZE,
                DEFAULT_DELIVERY_THREADS, DEFAULT_CHANNEL_BACKLOG);
    }

    public TopicSettings withChannelBacklog(final int backlog) {
        return new TopicSettings(memQueueSize, ingestQueueSize, maxMessageSize, deliveryThreads, backlog);
    }
}
