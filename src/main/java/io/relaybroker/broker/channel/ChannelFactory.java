package io.relaybroker.broker.channel;

/**
 * Creates the channel a topic registers the first time a channel name is requested.
 */
@FunctionalInterface
public interface ChannelFactory {
    Channel create(String topicName, String channelName);
}
