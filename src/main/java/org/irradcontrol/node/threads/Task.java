package org.irradcontrol.node.threads;

/**
 * Body of a worker thread. Any exception escaping {@link #run()} is captured by the
 * {@link WorkerThread} and reported by the {@link ThreadWatcher}.
 */
@FunctionalInterface
public interface Task {

    void run() throws Exception;
}
