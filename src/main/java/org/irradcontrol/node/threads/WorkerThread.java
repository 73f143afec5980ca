package org.irradcontrol.node.threads;

/**
 * A thread that runs a {@link Task} and keeps whatever it threw instead of letting it reach
 * the default uncaught-exception handler.
 */
public final class WorkerThread extends Thread {

    private final String purpose;
    private final Task task;
    private volatile Throwable failure;

    public WorkerThread(final String name, final String purpose, final Task task) {
        super(name);
        this.purpose = purpose;
        this.task = task;
        setDaemon(true);
    }

    @Override
    public void run() {
        try {
            task.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (Throwable t) {
            failure = t;
        }
    }

    public String purpose() {
        return purpose;
    }

    /**
     * @return What the task threw, or {@code null} if it has not failed.
     */
    public Throwable failure() {
        return failure;
    }
}
