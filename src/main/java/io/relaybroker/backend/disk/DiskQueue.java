package io.relaybroker.backend.disk;

import io.relaybroker.backend.BackendQueue;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.CRC32C;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed {@link BackendQueue}.
 * <p>
 * Records are appended to numbered data files ({@code <name>.diskqueue.000000.dat}, ...) framed as
 * {@code [length:int][crc32c:int][payload]}. A write that would push a non-empty file past
 * {@code maxBytesPerFile} starts the next file. The reader deletes a file once it has consumed it.
 * </p>
 * <p>
 * Read and write positions are checkpointed to {@code <name>.diskqueue.meta.dat} on every file
 * rotation and on close. On open, records appended after the last checkpoint are recovered by
 * scanning the tail of the write file; a torn or corrupt tail is truncated.
 * </p>
 */
@Slf4j
public final class DiskQueue implements BackendQueue {

    private static final int META_SIZE = Integer.BYTES + Short.BYTES + Long.BYTES * 5 + Integer.BYTES;

    @Getter private final String name;
    @Getter private final Path directory;
    @Getter private final long maxBytesPerFile;

    private final Lock lock = new ReentrantLock();
    private final CRC32C crc = new CRC32C();
    private final ByteBuffer headerScratch = ByteBuffer.allocate(DiskQueueConstant.RECORD_HEADER_SIZE);
    private final AtomicLong depth = new AtomicLong();

    private long readFileNum;
    private long readPos;
    private long writeFileNum;
    private long writePos;

    private FileChannel reader;
    private FileChannel writer;
    private boolean closed;

    private DiskQueue(final String name, final Path directory, final long maxBytesPerFile) {
        this.name = name;
        this.directory = directory;
        this.maxBytesPerFile = maxBytesPerFile;
    }

    /**
     * Opens (or creates) the queue called {@code name} under {@code directory}, resuming from
     * whatever a previous instance left on disk.
     */
    public static DiskQueue open(@NonNull final String name,
                                 @NonNull final Path directory,
                                 final long maxBytesPerFile) throws IOException {
        if (name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (maxBytesPerFile <= DiskQueueConstant.RECORD_HEADER_SIZE) {
            throw new IllegalArgumentException("maxBytesPerFile too small: " + maxBytesPerFile);
        }

        Files.createDirectories(directory);

        final DiskQueue queue = new DiskQueue(name, directory, maxBytesPerFile);
        queue.retrieveMetaData();
        queue.recoverWriteTail();

        log.info("DISKQUEUE({}): opened at {} (depth={}, read={}:{}, write={}:{})",
                name, directory, queue.depth.get(),
                queue.readFileNum, queue.readPos, queue.writeFileNum, queue.writePos);
        return queue;
    }

    @Override
    public void put(final byte[] data) throws IOException {
        lock.lock();
        try {
            if (closed) throw new IOException("diskqueue(" + name + ") is closed");

            final int recordSize = DiskQueueConstant.RECORD_HEADER_SIZE + data.length;
            if (writePos > 0 && writePos + recordSize > maxBytesPerFile) {
                rotateWriter();
            }
            if (writer == null) {
                writer = FileChannel.open(dataFile(writeFileNum), CREATE, READ, WRITE);
            }

            crc.reset();
            crc.update(data, 0, data.length);

            final ByteBuffer record = ByteBuffer.allocate(recordSize);
            record.putInt(data.length).putInt((int) crc.getValue()).put(data).flip();

            long position = writePos;
            while (record.hasRemaining()) {
                position += writer.write(record, position);
            }

            writePos += recordSize;
            depth.incrementAndGet();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] poll() throws IOException {
        lock.lock();
        try {
            if (closed) throw new IOException("diskqueue(" + name + ") is closed");

            while (true) {
                if (readFileNum == writeFileNum && readPos >= writePos) {
                    depth.set(0);
                    return null;
                }

                if (reader == null && !openReader()) {
                    continue;
                }

                final long limit = readFileNum == writeFileNum ? writePos : reader.size();
                if (readPos >= limit) {
                    // fully consumed a rotated file
                    advanceReadFile();
                    continue;
                }

                final byte[] payload = readRecord(limit);
                if (payload == null) {
                    continue;
                }

                readPos += DiskQueueConstant.RECORD_HEADER_SIZE + payload.length;
                depth.decrementAndGet();
                return payload;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long depth() {
        return depth.get();
    }

    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            if (closed) throw new IOException("diskqueue(" + name + ") already closed");
            closed = true;

            log.info("DISKQUEUE({}): closing", name);
            try {
                persistMetaData();
            } finally {
                closeReader();
                if (writer != null) {
                    try {
                        writer.force(true);
                    } finally {
                        writer.close();
                        writer = null;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
    }

    Path dataFile(final long fileNum) {
        return directory.resolve(String.format("%s%s%06d%s", name, DiskQueueConstant.FILE_INFIX, fileNum, DiskQueueConstant.DATA_EXT));
    }

    Path metaFile() {
        return directory.resolve(name + DiskQueueConstant.META_SUFFIX);
    }

    /*
     * Reads one record at readPos. Returns null if the record was unreadable, in which case the
     * current read file has been set aside and the reader moved on.
     */
    private byte[] readRecord(final long limit) throws IOException {
        if (readPos + DiskQueueConstant.RECORD_HEADER_SIZE > limit) {
            handleReadError("partial record header at " + readPos);
            return null;
        }

        headerScratch.clear();
        readFully(reader, headerScratch, readPos);
        headerScratch.flip();
        final int length = headerScratch.getInt();
        final int storedCrc = headerScratch.getInt();

        if (length < 0 || readPos + DiskQueueConstant.RECORD_HEADER_SIZE + length > limit) {
            handleReadError("invalid record length " + length + " at " + readPos);
            return null;
        }

        final byte[] payload = new byte[length];
        readFully(reader, ByteBuffer.wrap(payload), readPos + DiskQueueConstant.RECORD_HEADER_SIZE);

        crc.reset();
        crc.update(payload, 0, length);
        if ((int) crc.getValue() != storedCrc) {
            handleReadError("CRC mismatch at " + readPos);
            return null;
        }
        return payload;
    }

    private boolean openReader() throws IOException {
        try {
            reader = FileChannel.open(dataFile(readFileNum), READ);
            return true;
        } catch (final NoSuchFileException e) {
            handleReadError("missing data file");
            return false;
        }
    }

    private void advanceReadFile() throws IOException {
        final Path consumed = dataFile(readFileNum);
        closeReader();
        readFileNum++;
        readPos = 0;
        persistMetaData();

        Files.deleteIfExists(consumed);
    }

    /*
     * Sets the current read file aside and skips to the next one. If it is also the write file,
     * the writer moves on as well so the bad file is never appended to again.
     */
    private void handleReadError(final String reason) throws IOException {
        final Path bad = dataFile(readFileNum);
        log.error("DISKQUEUE({}): unreadable data file {} - {}", name, bad, reason);

        closeReader();
        if (readFileNum == writeFileNum) {
            if (writer != null) {
                writer.close();
                writer = null;
            }
            writeFileNum++;
            writePos = 0;
        }

        if (Files.exists(bad)) {
            final Path renamed = bad.resolveSibling(bad.getFileName() + DiskQueueConstant.BAD_EXT);
            Files.move(bad, renamed, StandardCopyOption.REPLACE_EXISTING);
            log.warn("DISKQUEUE({}): moved {} to {}", name, bad, renamed);
        }

        readFileNum++;
        readPos = 0;
        if (readFileNum == writeFileNum && readPos >= writePos) {
            depth.set(0);
        }
        persistMetaData();
    }

    private void rotateWriter() throws IOException {
        if (writer != null) {
            writer.truncate(writePos);
            writer.force(true);
            writer.close();
            writer = null;
        }
        writeFileNum++;
        writePos = 0;
        persistMetaData();
    }

    private void closeReader() throws IOException {
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    private void persistMetaData() throws IOException {
        final ByteBuffer buf = ByteBuffer.allocate(META_SIZE);
        buf.putInt(DiskQueueConstant.META_MAGIC)
                .putShort(DiskQueueConstant.META_VERSION)
                .putLong(depth.get())
                .putLong(readFileNum)
                .putLong(readPos)
                .putLong(writeFileNum)
                .putLong(writePos);

        final CRC32C metaCrc = new CRC32C();
        metaCrc.update(buf.array(), 0, buf.position());
        buf.putInt((int) metaCrc.getValue()).flip();

        final Path meta = metaFile();
        final Path tmp = meta.resolveSibling(meta.getFileName() + ".tmp");
        try (final FileChannel ch = FileChannel.open(tmp, CREATE, TRUNCATE_EXISTING, WRITE)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        }
        Files.move(tmp, meta, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void retrieveMetaData() throws IOException {
        final Path meta = metaFile();
        if (!Files.exists(meta)) {
            return;
        }

        final byte[] raw = Files.readAllBytes(meta);
        if (raw.length != META_SIZE) {
            throw new IOException("Bad metadata size " + raw.length + " in " + meta);
        }

        final ByteBuffer buf = ByteBuffer.wrap(raw);
        final int magic = buf.getInt();
        final short version = buf.getShort();
        if (magic != DiskQueueConstant.META_MAGIC || version != DiskQueueConstant.META_VERSION) {
            throw new IOException("Bad magic/version in " + meta);
        }

        final long storedDepth = buf.getLong();
        final long rFile = buf.getLong();
        final long rPos = buf.getLong();
        final long wFile = buf.getLong();
        final long wPos = buf.getLong();

        final CRC32C metaCrc = new CRC32C();
        metaCrc.update(raw, 0, buf.position());
        if ((int) metaCrc.getValue() != buf.getInt()) {
            throw new IOException("Metadata CRC mismatch in " + meta);
        }

        this.depth.set(storedDepth);
        this.readFileNum = rFile;
        this.readPos = rPos;
        this.writeFileNum = wFile;
        this.writePos = wPos;
    }

    /*
     * Picks up records appended after the last metadata checkpoint and truncates anything
     * past the last valid one.
     */
    private void recoverWriteTail() throws IOException {
        final Path file = dataFile(writeFileNum);
        if (!Files.exists(file)) {
            return;
        }

        try (final FileChannel ch = FileChannel.open(file, READ, WRITE)) {
            final long size = ch.size();
            if (size < writePos) {
                throw new IOException("Data file " + file + " is shorter (" + size + ") than its checkpoint (" + writePos + ")");
            }

            long position = writePos;
            long recovered = 0;
            final ByteBuffer header = ByteBuffer.allocate(DiskQueueConstant.RECORD_HEADER_SIZE);

            while (position + DiskQueueConstant.RECORD_HEADER_SIZE <= size) {
                header.clear();
                readFully(ch, header, position);
                header.flip();
                final int length = header.getInt();
                final int storedCrc = header.getInt();

                if (length < 0 || position + DiskQueueConstant.RECORD_HEADER_SIZE + length > size) {
                    break;
                }

                final byte[] payload = new byte[length];
                readFully(ch, ByteBuffer.wrap(payload), position + DiskQueueConstant.RECORD_HEADER_SIZE);
                crc.reset();
                crc.update(payload, 0, length);
                if ((int) crc.getValue() != storedCrc) {
                    break;
                }

                position += DiskQueueConstant.RECORD_HEADER_SIZE + length;
                recovered++;
            }

            if (position < size) {
                log.warn("DISKQUEUE({}): truncating {} bytes of torn data at {}:{}", name, size - position, writeFileNum, position);
                ch.truncate(position);
                ch.force(true);
            }

            if (recovered > 0) {
                log.info("DISKQUEUE({}): recovered {} records past checkpoint", name, recovered);
            }
            writePos = position;
            depth.addAndGet(recovered);
        }
    }

    private static void readFully(final FileChannel ch, final ByteBuffer dst, final long position) throws IOException {
        long p = position;
        while (dst.hasRemaining()) {
            final int n = ch.read(dst, p);
            if (n < 0) throw new EOFException("Unexpected end of file at " + p);
            p += n;
        }
    }
}
