package org.tfviewer.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Components that expose metrics, recorded errors and a health flag.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics, keyed by snake_case metric name.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded so far.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the recorded errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is running without recorded errors.
     *
     * @return true if healthy.
     */
    boolean isHealthy();
}
