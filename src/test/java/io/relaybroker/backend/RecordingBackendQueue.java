package io.relaybroker.backend;

import java.io.IOException;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link BackendQueue} that records what was appended and how often it was closed.
 */
public final class RecordingBackendQueue implements BackendQueue {

    private final Queue<byte[]> records = new ConcurrentLinkedQueue<>();
    private final List<byte[]> appended = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();

    private volatile boolean failPuts;
    private volatile boolean failClose;
    private volatile CountDownLatch putGate;
    private final CountDownLatch putHeld = new CountDownLatch(1);

    public void failPuts(final boolean fail) {
        this.failPuts = fail;
    }

    public void failClose(final boolean fail) {
        this.failClose = fail;
    }

    /** Makes every {@link #put} wait for {@code gate}, ignoring interrupts. */
    public void holdPuts(final CountDownLatch gate) {
        this.putGate = gate;
    }

    /** Waits until a put is parked on the gate set by {@link #holdPuts}. */
    public boolean awaitHeldPut(final long timeoutMillis) throws InterruptedException {
        return putHeld.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /** Makes a record available to readers without going through {@link #put}. */
    public void seed(final byte[] data) {
        records.offer(data);
    }

    public List<byte[]> appended() {
        return appended;
    }

    public int closeCount() {
        return closeCount.get();
    }

    @Override
    public void put(final byte[] data) throws IOException {
        if (failPuts) throw new IOException("simulated put failure");
        final CountDownLatch gate = putGate;
        if (gate != null) {
            putHeld.countDown();
            awaitIgnoringInterrupts(gate);
        }
        appended.add(data);
        records.offer(data);
    }

    @Override
    public byte[] poll() {
        return records.poll();
    }

    @Override
    public long depth() {
        return records.size();
    }

    @Override
    public void close() throws IOException {
        if (closeCount.incrementAndGet() > 1) throw new IOException("already closed");
        if (failClose) throw new IOException("simulated close failure");
    }

    private static void awaitIgnoringInterrupts(final CountDownLatch gate) {
        boolean interrupted = false;
        while (true) {
            try {
                gate.await();
                break;
            } catch (final InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }
}
