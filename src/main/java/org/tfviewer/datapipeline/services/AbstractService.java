package org.tfviewer.datapipeline.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.resources.IMonitorable;
import org.tfviewer.datapipeline.api.resources.OperationalError;
import org.tfviewer.datapipeline.api.services.IService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for services that run on a dedicated thread, providing lifecycle
 * management, error tracking and metrics. Subclasses implement {@link #run()}.
 * <p>
 * Stopping is cooperative. {@link #stop()} moves the service to {@link State#STOP_REQUESTED},
 * calls {@link #onStopRequested()} so the subclass can wake its thread, and joins. The service
 * thread is never interrupted: an interrupt would close any {@link java.nio.channels.FileChannel}
 * the thread is reading from. Subclasses poll {@link #isStopRequested()} at their checkpoints.
 * <p>
 * Error Tracking: Services can use {@link #recordError(String, String, String)} to track
 * transient errors that affect data completeness but don't require service termination.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    private final Duration stopTimeout;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.IDLE);
    private volatile Thread serviceThread;

    /**
     * Collection of operational errors that occurred during service execution. Bounded by
     * {@link #getMaxErrors()}; use {@link #recordError(String, String, String)} to add to it.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * @param name        The name of the service instance, also used as thread name.
     * @param stopTimeout How long {@link #stop()} waits for the service thread.
     */
    protected AbstractService(String name, Duration stopTimeout) {
        this.serviceName = name;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public void start() {
        if (!currentState.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        Thread thread = new Thread(this::runService);
        thread.setName(serviceName);
        serviceThread = thread;
        thread.start();
        logStarted();
    }

    /**
     * Template method for logging service startup.
     */
    protected void logStarted() {
        log.info("{} started", serviceName);
    }

    @Override
    public void stop() {
        if (currentState.compareAndSet(State.IDLE, State.STOPPED)) {
            log.debug("{} stopped before it was started", serviceName);
            return;
        }
        currentState.compareAndSet(State.RUNNING, State.STOP_REQUESTED);
        State state = getCurrentState();
        if (state == State.STOPPED || state == State.ERROR) {
            log.debug("{} already terminated in state {}", serviceName, state);
            return;
        }

        onStopRequested();
        Thread thread = serviceThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", serviceName);
                return;
            }
            if (thread.isAlive()) {
                log.error("{} thread did not stop within {} ms! Forcing ERROR state.", serviceName, stopTimeout.toMillis());
                currentState.set(State.ERROR);
                return;
            }
        }
        log.debug("{} stopped", serviceName);
    }

    /**
     * Called on the stopping thread after the state changed to {@link State#STOP_REQUESTED}.
     * Subclasses wake up their service thread here. The default implementation does nothing.
     */
    protected void onStopRequested() {
    }

    /**
     * @return true once {@link #stop()} was called.
     */
    protected boolean isStopRequested() {
        return getCurrentState() != State.RUNNING;
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Wraps {@link #run()} with error handling and state management.
     * <p>
     * <strong>Error Handling Strategy for Services:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong>: Catch, log, record, continue running</li>
     *   <li><strong>Fatal errors</strong>: Throw exception → automatically transitions to ERROR state</li>
     * </ul>
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    /**
     * The main logic of the service, executed on the service thread.
     * <p>
     * <strong>Error Handling Guidelines for Services:</strong>
     * <p>
     * <strong>1. Transient Errors</strong> (service continues running):
     * <ul>
     *   <li>Use: {@code log.warn("message", args)} - NO exception parameter</li>
     *   <li>Use: {@link #recordError(String, String, String)} to track</li>
     *   <li>Example: a read failed and will be retried, a corrupt record was skipped</li>
     * </ul>
     *
     * <strong>2. Fatal Errors</strong> (service must stop):
     * <ul>
     *   <li>Throw exception - AbstractService logs it and sets ERROR state</li>
     *   <li>Example: an index invariant was violated by a decoder</li>
     * </ul>
     *
     * <strong>Stack Traces:</strong> Exception stack traces are logged at DEBUG level only.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * Use this method ONLY for transient errors where the service continues running. These
     * errors affect the service's health status ({@link #isHealthy()}).
     *
     * @param code    Error code for categorization (e.g. "CORRUPT_RECORD", "READ_FAILED")
     * @param source  The file or directory the error relates to
     * @param message Human-readable error message
     */
    protected void recordError(String code, String source, String message) {
        errors.add(new OperationalError(Instant.now(), code, source, message));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * Returns whether the service is healthy: not in {@link State#ERROR} and no recorded errors.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }

    /**
     * Returns base metrics ({@code error_count}) plus whatever {@link #addCustomMetrics(Map)} adds.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add service-specific metrics. Always call
     * {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
