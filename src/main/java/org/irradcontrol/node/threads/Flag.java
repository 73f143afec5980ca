package org.irradcontrol.node.threads;

import java.time.Duration;

/**
 * A boolean condition shared between threads. Waiters block on an internal lock instead of
 * spinning, and are woken whenever the flag changes.
 */
public final class Flag {

    private final Object lock = new Object();
    private boolean set;

    public void set() {
        synchronized (lock) {
            set = true;
            lock.notifyAll();
        }
    }

    public void clear() {
        synchronized (lock) {
            set = false;
            lock.notifyAll();
        }
    }

    public boolean isSet() {
        synchronized (lock) {
            return set;
        }
    }

    /**
     * Blocks until the flag is set or the timeout elapses.
     *
     * @return {@code true} if the flag is set on return.
     */
    public boolean await(final Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (!set) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                lock.wait(remaining / 1_000_000, (int) (remaining % 1_000_000));
            }
            return true;
        }
    }

    @Override
    public String toString() {
        return "Flag[" + isSet() + "]";
    }
}
