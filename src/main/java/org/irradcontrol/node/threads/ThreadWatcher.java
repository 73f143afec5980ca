package org.irradcontrol.node.threads;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of all worker threads of a process. Exceptions captured by a worker are logged
 * once together with the role name and the purpose of the thread; terminated threads are
 * removed from the tracking list. No thread is ever stopped from here.
 */
public final class ThreadWatcher implements IThreadLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadWatcher.class);

    private final String roleName;
    private final List<WorkerThread> threads = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();

    public ThreadWatcher(final String roleName) {
        this.roleName = roleName;
    }

    @Override
    public Thread launch(final String purpose, final Task task) {
        final String name = roleName + "-" + purpose.replace(' ', '-') + "-" + sequence.incrementAndGet();
        final WorkerThread thread = new WorkerThread(name, purpose, task);
        threads.add(thread);
        thread.start();
        LOGGER.debug("Launched thread '{}'", name);
        return thread;
    }

    /**
     * Reports failed threads and reaps terminated ones.
     *
     * @return Number of threads still alive.
     */
    public int watch() {
        final List<WorkerThread> finished = new ArrayList<>();
        for (final WorkerThread thread : threads) {
            if (thread.isAlive()) {
                continue;
            }
            report(thread);
            finished.add(thread);
        }
        threads.removeAll(finished);
        return threads.size();
    }

    /**
     * Waits for every tracked thread to end. Threads still running after {@code timeout} are
     * logged and left alone.
     */
    public void joinAll(final Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        for (final WorkerThread thread : threads) {
            final long remainingMs = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            thread.join(remainingMs);
            if (thread.isAlive()) {
                LOGGER.warn("Thread '{}' of {} ({}) did not finish in time", thread.getName(), roleName, thread.purpose());
            }
        }
        watch();
    }

    public int aliveCount() {
        return (int) threads.stream().filter(Thread::isAlive).count();
    }

    private void report(final WorkerThread thread) {
        final Throwable failure = thread.failure();
        if (failure == null || failure instanceof InterruptedException) {
            return;
        }
        LOGGER.error("Exception in thread of {} for {}: {}", roleName, thread.purpose(), failure.toString(), failure);
    }
}
