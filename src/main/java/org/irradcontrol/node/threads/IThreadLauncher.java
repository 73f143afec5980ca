package org.irradcontrol.node.threads;

/**
 * Starts supervised worker threads.
 */
@FunctionalInterface
public interface IThreadLauncher {

    /**
     * Starts {@code task} on a new supervised thread.
     *
     * @param purpose Short description of what the thread does; used in its name and in error logs.
     * @param task    The body to run.
     * @return The started thread.
     */
    Thread launch(String purpose, Task task);
}
