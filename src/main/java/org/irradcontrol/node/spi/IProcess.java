package org.irradcontrol.node.spi;

/**
 * Defines the contract for a long-running, manageable process. Each process must be
 * self-contained and expose methods to control its lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process. This method is non-blocking; the process runs on its own thread.
     */
    void start();

    /**
     * Stops the process gracefully. Returns once all worker threads have ended and all
     * resources are released.
     */
    void stop();
}
