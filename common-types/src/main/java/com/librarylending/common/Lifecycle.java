package com.librarylending.common;

/**
 * Life cycle of a long running process, such as a subscription, a projection or a scheduled sweep
 */
public interface Lifecycle {
    /**
     * Start the process. Must be idempotent: calling {@link #start()} on a process where
     * {@link #isStarted()} returns true is ignored
     */
    void start();

    /**
     * Stop the process. Must be idempotent: calling {@link #stop()} on a process where
     * {@link #isStarted()} returns false is ignored
     */
    void stop();

    /**
     * @return true if the process is started otherwise false
     */
    boolean isStarted();
}
