package io.relaybroker.broker.channel;

import io.relaybroker.core.model.Message;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class QueueChannelTest {

    @Test
    void pollReturnsMessagesInOrderAndCountsAttempts() throws Exception {
        final QueueChannel channel = new QueueChannel("orders", "billing", 4);
        final Message first = Message.create(new byte[]{1});
        final Message second = Message.create(new byte[]{2});

        channel.putMessage(first);
        channel.putMessage(second);
        assertEquals(2, channel.depth());

        final Message polled = channel.poll(1, TimeUnit.SECONDS);
        assertSame(first, polled);
        assertEquals(1, polled.getAttempts());
        assertSame(second, channel.poll(1, TimeUnit.SECONDS));
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void messagesAfterCloseAreDropped() throws Exception {
        final QueueChannel channel = new QueueChannel("orders", "billing", 4);
        channel.close();

        channel.putMessage(Message.create(new byte[]{1}));
        assertEquals(0, channel.depth());
        assertTrue(channel.isClosed());
    }

    @Test
    void closingTwiceFails() throws Exception {
        final QueueChannel channel = new QueueChannel("orders", "billing", 4);
        channel.close();
        assertThrows(IOException.class, channel::close);
    }

    @Test
    void factoryBuildsChannelsNamedAfterTopicAndChannel() {
        final Channel channel = QueueChannel.factory(8).create("orders", "audit");
        assertEquals("audit", channel.getName());
        assertEquals("orders", ((QueueChannel) channel).getTopicName());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new QueueChannel("orders", "billing", 0));
    }
}
