package io.relaybroker.core.model;

import lombok.Getter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.zip.CRC32C;

/**
 * Binary layout of a {@link Message} as stored in a backend queue.
 * <pre>
 * offset  size  field
 * 0       8     timestamp
 * 8       16    id
 * 24      4     body length N
 * 28      N     body
 * 28+N    4     CRC32C over [0, 28+N)
 * </pre>
 * All integers are big-endian.
 */
public final class MessageCodec {
    private static final int TIMESTAMP_POS = 0;
    private static final int ID_POS = TIMESTAMP_POS + Long.BYTES;
    private static final int LENGTH_POS = ID_POS + Message.ID_LENGTH;
    public static final int HEADER_SIZE = LENGTH_POS + Integer.BYTES;
    public static final int OVERHEAD = HEADER_SIZE + Integer.BYTES;

    public static final int DEFAULT_MAX_BODY_SIZE = 1024 * 1024;

    @Getter private final int maxBodySize;

    public MessageCodec() {
        this(DEFAULT_MAX_BODY_SIZE);
    }

    public MessageCodec(final int maxBodySize) {
        if (maxBodySize <= 0 || maxBodySize > Integer.MAX_VALUE - OVERHEAD) {
            throw new IllegalArgumentException("maxBodySize out of range: " + maxBodySize);
        }
        this.maxBodySize = maxBodySize;
    }

    /**
     * @throws IOException if the body is larger than {@link #getMaxBodySize()}
     */
    public byte[] encode(final Message message) throws IOException {
        final byte[] body = message.getBody();
        if (body.length > maxBodySize) {
            throw new IOException("message body of " + body.length + " bytes exceeds limit of " + maxBodySize);
        }

        final ByteBuffer buf = ByteBuffer.allocate(OVERHEAD + body.length);
        buf.putLong(message.getTimestamp())
                .put(message.getId())
                .putInt(body.length)
                .put(body);

        final CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    public Message decode(final byte[] data) throws CorruptMessageException {
        if (data == null || data.length < OVERHEAD) {
            throw new CorruptMessageException("record too short: " + (data == null ? 0 : data.length) + " bytes");
        }

        final ByteBuffer buf = ByteBuffer.wrap(data);
        final int bodyLength = buf.getInt(LENGTH_POS);
        if (bodyLength < 0 || bodyLength != data.length - OVERHEAD) {
            throw new CorruptMessageException("body length " + bodyLength + " does not match record of " + data.length + " bytes");
        }

        final CRC32C crc = new CRC32C();
        crc.update(data, 0, HEADER_SIZE + bodyLength);
        final int storedCrc = buf.getInt(HEADER_SIZE + bodyLength);
        if ((int) crc.getValue() != storedCrc) {
            throw new CorruptMessageException("CRC mismatch");
        }

        final long timestamp = buf.getLong(TIMESTAMP_POS);
        final byte[] id = new byte[Message.ID_LENGTH];
        buf.position(ID_POS).get(id);
        final byte[] body = new byte[bodyLength];
        buf.position(HEADER_SIZE).get(body);

        return new Message(id, body, timestamp);
    }
}
