package io.relaybroker.registry;

import io.relaybroker.broker.topic.Topic;

/**
 * Notified when a {@link TopicRegistry} creates a topic.
 */
@FunctionalInterface
public interface TopicListener {
    void onTopicCreated(Topic topic);
}
