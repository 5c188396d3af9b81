package org.tfviewer.datapipeline.api.services;

import org.tfviewer.datapipeline.api.resources.OperationalError;

import java.util.List;

/**
 * Lifecycle contract for background components that own a dedicated worker thread.
 * <p>
 * A service is started exactly once. Stopping is cooperative: the service observes a
 * stop request at well-defined checkpoints and unwinds on its own thread; the caller of
 * {@link #stop()} blocks until that thread has terminated. A stopped service cannot be
 * restarted, a new instance must be created instead.
 */
public interface IService {

    /**
     * The lifecycle state of a service.
     */
    enum State {
        /**
         * Created but not yet started.
         */
        IDLE,
        /**
         * The service thread is running.
         */
        RUNNING,
        /**
         * A stop was requested and the service thread is unwinding.
         */
        STOP_REQUESTED,
        /**
         * The service thread has terminated normally. Terminal.
         */
        STOPPED,
        /**
         * The service thread terminated because of a fatal error. Terminal.
         */
        ERROR
    }

    /**
     * Starts the service thread.
     *
     * @throws IllegalStateException if the service is not {@link State#IDLE}
     */
    void start();

    /**
     * Requests the service to stop and waits for its thread to terminate.
     * Calling this method on a service that is already stopped has no effect.
     */
    void stop();

    /**
     * Returns the current state of the service.
     *
     * @return The current {@link State}.
     */
    State getCurrentState();

    /**
     * Returns the operational errors recorded by the service.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the recorded operational errors.
     */
    void clearErrors();
}
