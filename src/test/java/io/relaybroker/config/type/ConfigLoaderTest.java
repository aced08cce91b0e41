package io.relaybroker.config.type;

import io.relaybroker.broker.topic.TopicSettings;
import io.relaybroker.config.impl.BrokerConfig;
import io.relaybroker.config.impl.TopicConfig;
import io.relaybroker.registry.TopicRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    private static String resource(final String name) throws Exception {
        return Paths.get(ConfigLoaderTest.class.getResource("/" + name).toURI()).toString();
    }

    @Test
    void loadsBrokerConfigWithDefaults() throws Exception {
        final BrokerConfig cfg = ConfigLoader.load(resource("broker-test.yaml"));

        assertEquals("/tmp/relaybroker-test", cfg.getDataPath());
        assertEquals("topics-test.yaml", cfg.getTopicsFile());
        assertEquals(2, cfg.getMemQueueSize());
        assertEquals(4096L, cfg.getMaxBytesPerFile());
        assertEquals(16, cfg.getChannelQueueSize());
        assertEquals(TopicSettings.DEFAULT_INGEST_QUEUE_SIZE, cfg.getIngestQueueSize());
        assertEquals(TopicSettings.DEFAULT_MAX_MESSAGE_SIZE, cfg.getMaxMessageSize());
        assertEquals(TopicSettings.DEFAULT_DELIVERY_THREADS, cfg.getDeliveryThreads());
        assertEquals(TopicSettings.DEFAULT_CHANNEL_BACKLOG, cfg.getChannelBacklog());

        final TopicSettings settings = cfg.topicSettings();
        assertEquals(2, settings.memQueueSize());
        assertEquals(TopicSettings.DEFAULT_INGEST_QUEUE_SIZE, settings.ingestQueueSize());
        assertEquals(TopicSettings.DEFAULT_CHANNEL_BACKLOG, settings.channelBacklog());
    }

    @Test
    void loadsTopicsWithOptionalChannels() throws Exception {
        final List<TopicConfig> topics = ConfigLoader.loadTopics(resource("topics-test.yaml"));

        assertEquals(2, topics.size());
        assertEquals("orders", topics.get(0).getName());
        assertEquals(List.of("c1", "c2"), topics.get(0).getChannels());
        assertEquals("events", topics.get(1).getName());
        assertTrue(topics.get(1).getChannels().isEmpty());
    }

    @Test
    void missingDataPathIsRejected() throws Exception {
        final Path file = dir.resolve("broker.yaml");
        Files.writeString(file, "memQueueSize: 10\n");

        assertThrows(IOException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    void wrongValueTypeIsRejected() throws Exception {
        final Path file = dir.resolve("broker.yaml");
        Files.writeString(file, "dataPath: ./data\nmemQueueSize: lots\n");

        assertThrows(IOException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    void registryBuiltFromConfigUsesItsDataPath() throws Exception {
        final Path file = dir.resolve("broker.yaml");
        Files.writeString(file, "dataPath: " + dir.resolve("data") + "\nmemQueueSize: 0\n");

        try (final TopicRegistry registry = TopicRegistry.fromConfig(ConfigLoader.load(file.toString()))) {
            registry.getTopic("orders");
            assertTrue(Files.isDirectory(dir.resolve("data")));
        }
    }
}
