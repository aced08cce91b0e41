package io.relaybroker.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class MessageTest {

    @Test
    void createAssignsIdAndTimestamp() {
        final long before = System.currentTimeMillis();
        final Message m = Message.create("hello".getBytes(StandardCharsets.UTF_8));

        assertEquals(Message.ID_LENGTH, m.getId().length);
        assertTrue(m.getTimestamp() >= before);
        assertEquals(0, m.getAttempts());
    }

    @Test
    void createCopiesTheCallersBuffer() {
        final byte[] buffer = "first".getBytes(StandardCharsets.UTF_8);
        final Message m = Message.create(buffer);

        buffer[0] = 'X';

        assertNotSame(buffer, m.getBody());
        assertArrayEquals("first".getBytes(StandardCharsets.UTF_8), m.getBody());
    }

    @Test
    void idsAreUnique() {
        assertNotEquals(Message.create(new byte[0]), Message.create(new byte[0]));
    }

    @Test
    void rejectsWrongIdLength() {
        assertThrows(IllegalArgumentException.class, () -> new Message(new byte[4], new byte[0], 1L));
    }

    @Test
    void copyIsEqualButIndependent() {
        final Message original = Message.create("payload".getBytes(StandardCharsets.UTF_8));
        original.incrementAttempts();

        final Message copy = original.copy();
        assertEquals(original, copy);
        assertEquals(original.hashCode(), copy.hashCode());
        assertNotSame(original.getBody(), copy.getBody());
        assertNotSame(original.getId(), copy.getId());
        assertEquals(0, copy.getAttempts(), "copy starts with fresh bookkeeping");

        copy.getBody()[0] = 'X';
        copy.incrementAttempts();
        copy.incrementAttempts();

        assertEquals('p', original.getBody()[0]);
        assertEquals(1, original.getAttempts());
    }

    @Test
    void attemptsDoNotAffectEquality() {
        final Message m = Message.create(new byte[]{1, 2, 3});
        final Message copy = m.copy();
        copy.incrementAttempts();
        assertEquals(m, copy);
    }
}
