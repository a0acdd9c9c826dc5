package com.github.ytdle.service.fetch;

/**
 * Interruption handle handed to a {@link FetchAdapter} for the duration of one attempt.
 */
public interface FetchControl {

    /**
     * Register the teardown action of the running attempt (typically killing the tool's process tree).
     *
     * @return false if teardown was already requested; the caller must then stop without starting work
     */
    boolean attach(Runnable teardown);

    /**
     * Forget the teardown action once the attempt has ended.
     */
    void detach();

    /**
     * Whether pause, cancel, skip or shutdown tore this attempt down.
     */
    boolean isInterruptRequested();
}
