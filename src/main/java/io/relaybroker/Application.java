package io.relaybroker;

import io.relaybroker.broker.topic.Topic;
import io.relaybroker.config.impl.BrokerConfig;
import io.relaybroker.config.impl.TopicConfig;
import io.relaybroker.config.type.ConfigLoader;
import io.relaybroker.registry.TopicRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

/**
 * Main class to start the RelayBroker application.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar relaybroker.jar <broker-config.yaml>");
            System.exit(1);
        }

        /* Load broker settings and topic definitions */
        final BrokerConfig cfg = ConfigLoader.load(args[0]);
        final List<TopicConfig> topics = cfg.getTopicsFile() == null
                ? List.of()
                : ConfigLoader.loadTopics(cfg.getTopicsFile());

        /* Prepare data directory */
        final Path dataDir = Paths.get(cfg.getDataPath()).toAbsolutePath();
        final boolean wipeOnStart = Boolean.parseBoolean(
                System.getProperty("relaybroker.wipeDataOnStart",
                        System.getenv().getOrDefault("RELAYBROKER_WIPE_DATA_ON_START", "false"))
        );

        if (wipeOnStart && Files.exists(dataDir)) {
            log.warn("relaybroker.wipeDataOnStart=true -> wiping data directory at {}", dataDir);
            wipe(dataDir);
        } else if (!Files.exists(dataDir)) {
            Files.createDirectories(dataDir);
        } else {
            log.info("Reusing existing data directory at {}", dataDir);
        }

        final TopicRegistry registry = TopicRegistry.fromConfig(cfg);
        registry.addListener(topic -> log.info("New topic announced: {}", topic.getName()));

        for (final TopicConfig t : topics) {
            final Topic topic = registry.getTopic(t.getName());
            for (final String channel : t.getChannels()) {
                topic.getChannel(channel);
            }
        }

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down, closing {} topics", registry.listTopics().size());
            try {
                registry.close();
            } catch (final IOException e) {
                log.error("Topic shutdown reported a failure", e);
            } finally {
                stopped.countDown();
            }
        }, "relaybroker-shutdown"));

        log.info("RelayBroker started with data path {} and {} topics", dataDir, registry.listTopics().size());
        stopped.await();
    }

    private static void wipe(final Path dataDir) throws IOException {
        try (final Stream<Path> stream = Files.walk(dataDir)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(p -> !p.equals(dataDir))
                    .map(Path::toFile)
                    .forEach(file -> {
                        if (!file.delete()) {
                            log.warn("Failed to delete file: {}", file.getAbsolutePath());
                        }
                    });
        }
    }
}
