package io.relaybroker.registry;

import io.relaybroker.backend.disk.DiskQueue;
import io.relaybroker.broker.channel.ChannelFactory;
import io.relaybroker.broker.channel.QueueChannel;
import io.relaybroker.broker.topic.Topic;
import io.relaybroker.broker.topic.TopicSettings;
import io.relaybroker.config.impl.BrokerConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Broker-wide set of topics, created on first reference.
 * <p>
 * Each topic gets a {@link DiskQueue} named after it under the data path and builds its channels
 * with the registry's {@link ChannelFactory}. Listeners hear about every topic the registry
 * creates.
 * </p>
 */
@Slf4j
public final class TopicRegistry implements AutoCloseable {

    private static final Pattern VALID_NAME = Pattern.compile("[.a-zA-Z0-9_-]{1,64}");

    private final Path dataPath;
    private final TopicSettings settings;
    private final long maxBytesPerFile;
    private final ChannelFactory channelFactory;

    private final ConcurrentMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final List<TopicListener> listeners = new CopyOnWriteArrayList<>();
    private final Lock createLock = new ReentrantLock();
    private volatile boolean closed;

    private TopicRegistry(final Builder builder) {
        this.dataPath = Objects.requireNonNull(builder.dataPath, "dataPath");
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.channelFactory = Objects.requireNonNull(builder.channelFactory, "channelFactory");
        if (builder.maxBytesPerFile <= 0) throw new IllegalArgumentException("maxBytesPerFile must be > 0");
        this.maxBytesPerFile = builder.maxBytesPerFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TopicRegistry fromConfig(final BrokerConfig cfg) {
        return builder()
                .dataPath(Path.of(cfg.getDataPath()))
                .settings(cfg.topicSettings())
                .maxBytesPerFile(cfg.getMaxBytesPerFile())
                .channelFactory(QueueChannel.factory(cfg.getChannelQueueSize()))
                .build();
    }

    public static boolean isValidName(final String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    /**
     * Returns the topic called {@code name}, creating it and its disk queue on first use.
     *
     * @throws IOException if the topic's disk queue cannot be opened
     */
    public Topic getTopic(final String name) throws IOException {
        if (!isValidName(name)) throw new IllegalArgumentException("invalid topic name: " + name);

        final Topic existing = topics.get(name);
        if (existing != null) return existing;

        final Topic created;
        createLock.lock();
        try {
            if (closed) throw new IllegalStateException("registry is closed");

            final Topic raced = topics.get(name);
            if (raced != null) return raced;

            final DiskQueue backend = DiskQueue.open(name, dataPath, maxBytesPerFile);
            created = Topic.create(name, settings, backend, channelFactory);
            topics.put(name, created);
        } finally {
            createLock.unlock();
        }

        for (final TopicListener listener : listeners) {
            try {
                listener.onTopicCreated(created);
            } catch (final RuntimeException e) {
                log.error("Topic listener failed for new topic {}", name, e);
            }
        }
        return created;
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    public Set<String> listTopics() {
        return Collections.unmodifiableSet(topics.keySet());
    }

    public void addListener(final TopicListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final TopicListener listener) {
        listeners.remove(listener);
    }

    /**
     * Removes and closes a topic. Its disk queue files stay on disk.
     *
     * @return {@code false} if no such topic exists
     */
    public boolean deleteTopic(final String name) throws IOException {
        final Topic topic;
        createLock.lock();
        try {
            topic = topics.remove(name);
        } finally {
            createLock.unlock();
        }
        if (topic == null) return false;

        log.info("Deleting topic {}", name);
        topic.close();
        return true;
    }

    /**
     * Closes every topic. All topics get a close attempt; the first failure is rethrown afterwards.
     */
    @Override
    public void close() throws IOException {
        final List<Topic> toClose;
        createLock.lock();
        try {
            if (closed) return;
            closed = true;
            toClose = new ArrayList<>(topics.values());
            topics.clear();
        } finally {
            createLock.unlock();
        }

        IOException first = null;
        for (final Topic topic : toClose) {
            try {
                topic.close();
            } catch (final IOException e) {
                log.error("Failed to close topic {}", topic.getName(), e);
                if (first == null) first = e;
            }
        }
        if (first != null) throw first;
    }

    public static final class Builder {
        private Path dataPath;
        private TopicSettings settings = TopicSettings.defaults();
        private long maxBytesPerFile = 100L * 1024 * 1024;
        private ChannelFactory channelFactory = QueueChannel.factory(TopicSettings.DEFAULT_MEM_QUEUE_SIZE);

        public Builder dataPath(final Path dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder settings(final TopicSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder maxBytesPerFile(final long maxBytesPerFile) {
            this.maxBytesPerFile = maxBytesPerFile;
            return this;
        }

        public Builder channelFactory(final ChannelFactory channelFactory) {
            this.channelFactory = channelFactory;
            return this;
        }

        public TopicRegistry build() {
            return new TopicRegistry(this);
        }
    }
}
