package io.relaybroker.core.barrier;

import lombok.Getter;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates wake-ups between a topic's loops and doubles as their shutdown token.
 * <p>
 * Producers call {@link #signal()} after making work available; an idle consumer parks in
 * {@link #block(long, TimeUnit)}. A signal raised while nobody is parked is remembered, so the
 * next {@code block} returns immediately. {@link #alert()} is sticky and releases every waiter.
 * </p>
 */
public final class Barrier {
    private final Lock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();

    private boolean pending;

    /**
     * -- GETTER --
     * Whether shutdown has been requested.
     */
    @Getter
    private volatile boolean alerted;

    /** Wake a blocked consumer, or let the next {@link #block} fall through. */
    public void signal() {
        lock.lock();
        try {
            pending = true;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Mark as alerted and wake up waiters. */
    public void alert() {
        lock.lock();
        try {
            alerted = true;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Park until signalled, alerted or the timeout elapses.
     *
     * @return {@code true} if woken by a signal or alert, {@code false} on timeout
     */
    public boolean block(final long timeout, final TimeUnit unit) throws InterruptedException {
        lock.lock();
        try {
            long nanos = unit.toNanos(timeout);
            while (!pending && !alerted) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = condition.awaitNanos(nanos);
            }
            pending = false;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
