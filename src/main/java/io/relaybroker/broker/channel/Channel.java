package io.relaybroker.broker.channel;

import io.relaybroker.core.model.Message;

import java.io.IOException;

/**
 * A subscriber queue fed by a topic. Every channel receives its own copy of each topic message.
 */
public interface Channel extends AutoCloseable {

    String getName();

    /**
     * Hand a message to this channel. The channel owns the instance from here on.
     */
    void putMessage(Message message);

    @Override
    void close() throws IOException;
}
