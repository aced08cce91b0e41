package io.relaybroker.config.impl;

import io.relaybroker.broker.topic.TopicSettings;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Immutable config holder loaded from broker.yaml
 */
@Getter
public final class BrokerConfig {

    private String dataPath;
    private String topicsFile;
    private int memQueueSize;
    private int ingestQueueSize;
    private long maxBytesPerFile;
    private int maxMessageSize;
    private int channelQueueSize;
    private int deliveryThreads;
    private int channelBacklog;

    public static BrokerConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) throw new IOException("empty broker config: " + path);

            final BrokerConfig cfg = new BrokerConfig();

            cfg.dataPath         = (String) require(m, "dataPath");
            cfg.topicsFile       = (String) m.get("topicsFile");
            cfg.memQueueSize     = (Integer) m.getOrDefault("memQueueSize", TopicSettings.DEFAULT_MEM_QUEUE_SIZE);
            cfg.ingestQueueSize  = (Integer) m.getOrDefault("ingestQueueSize", TopicSettings.DEFAULT_INGEST_QUEUE_SIZE);
            cfg.maxBytesPerFile  = ((Number) m.getOrDefault("maxBytesPerFile", 100L * 1024 * 1024)).longValue();
            cfg.maxMessageSize   = (Integer) m.getOrDefault("maxMessageSize", TopicSettings.DEFAULT_MAX_MESSAGE_SIZE);
            cfg.channelQueueSize = (Integer) m.getOrDefault("channelQueueSize", TopicSettings.DEFAULT_MEM_QUEUE_SIZE);
            cfg.deliveryThreads  = (Integer) m.getOrDefault("deliveryThreads", TopicSettings.DEFAULT_DELIVERY_THREADS);
            cfg.channelBacklog   = (Integer) m.getOrDefault("channelBacklog", TopicSettings.DEFAULT_CHANNEL_BACKLOG);

            return cfg;
        } catch (final ClassCastException e) {
            throw new IOException("malformed broker config " + path + ": " + e.getMessage(), e);
        }
    }

    public TopicSettings topicSettings() {
        return new TopicSettings(memQueueSize, ingestQueueSize, maxMessageSize, deliveryThreads, channelBacklog);
    }

    private static Object require(final Map<String, Object> m, final String key) throws IOException {
        final Object value = m.get(key);
        if (value == null) throw new IOException("missing required key '" + key + "'");
        return value;
    }
}
