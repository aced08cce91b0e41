package io.relaybroker.core.model;

import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope routed through a topic: a 16-byte id, an opaque body and a creation timestamp.
 * <p>
 * Id, body and timestamp never change once the message exists. The delivery bookkeeping
 * ({@link #getAttempts()}) belongs to whichever channel owns this instance, which is why the
 * topic hands every channel its own {@link #copy()}.
 * </p>
 */
public final class Message {

    public static final int ID_LENGTH = 16;

    private final byte[] id;
    private final byte[] body;
    @Getter private final long timestamp;

    @Getter private int attempts;

    /**
     * Wraps {@code id} and {@code body} without copying them; the caller hands both arrays over
     * and must not touch them afterwards. {@link #create(byte[])} copies instead.
     */
    public Message(final byte[] id, final byte[] body, final long timestamp) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(body, "body");
        if (id.length != ID_LENGTH) {
            throw new IllegalArgumentException("message id must be " + ID_LENGTH + " bytes, got " + id.length);
        }
        this.id = id;
        this.body = body;
        this.timestamp = timestamp;
    }

    /**
     * Creates a message with a random id, stamped with the current wall-clock time. The body is
     * copied, so the caller may reuse its buffer.
     */
    public static Message create(final byte[] body) {
        Objects.requireNonNull(body, "body");
        return new Message(newId(), body.clone(), System.currentTimeMillis());
    }

    public static byte[] newId() {
        final UUID uuid = UUID.randomUUID();
        return ByteBuffer.allocate(ID_LENGTH)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    /**
     * The id bytes. Callers must not modify the returned array.
     */
    public byte[] getId() {
        return id;
    }

    /**
     * The body bytes. Callers must not modify the returned array.
     */
    public byte[] getBody() {
        return body;
    }

    /**
     * Independent instance with the same id, body and timestamp, backed by its own arrays and
     * starting with no delivery attempts.
     */
    public Message copy() {
        return new Message(id.clone(), body.clone(), timestamp);
    }

    public int incrementAttempts() {
        return ++attempts;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        final Message other = (Message) o;
        return timestamp == other.timestamp
                && Arrays.equals(id, other.id)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(id);
        result = 31 * result + Arrays.hashCode(body);
        result = 31 * result + Long.hashCode(timestamp);
        return result;
    }

    @Override
    public String toString() {
        return "Message{id=" + hex(id) + ", bodyLength=" + body.length + ", timestamp=" + timestamp + '}';
    }

    private static String hex(final byte[] bytes) {
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (final byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
