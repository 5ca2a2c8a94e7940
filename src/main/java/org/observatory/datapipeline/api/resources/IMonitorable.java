package org.observatory.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * An interface for components that can be monitored.
 * <p>
 * Provides a standard way to retrieve metrics, errors, and health status from services and
 * resources.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component, e.g. {@code "ticks_committed"} or
     * {@code "current_size"}.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * @return the recorded {@link OperationalError}s, oldest first
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors, typically after an operator investigated them.
     */
    void clearErrors();

    /**
     * @return true if the component is healthy, false if it is in a degraded or failed state.
     */
    boolean isHealthy();
}
