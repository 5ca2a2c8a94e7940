package org.observatory.datapipeline.resources;

import org.observatory.datapipeline.api.resources.IMonitorable;
import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.datapipeline.api.resources.OperationalError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Common part of the queue, ledger, snapshot store and rejection log: the configured name and the
 * monitoring surface.
 * <p>
 * Only failures the resource survives go to {@link #recordError(String, String, String)}. A failure
 * that leaves the resource unusable is logged at ERROR and thrown to the caller.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    private final RecentErrors errors = new RecentErrors();

    protected AbstractResource(String name) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    protected void recordError(String errorType, String message, String details) {
        errors.add(errorType, message, details);
    }

    @Override
    public List<OperationalError> getErrors() {
        return errors.list();
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return getState() != ResourceState.FAILED && errors.isEmpty();
    }

    /**
     * Reports {@code error_count} followed by whatever {@link #addCustomMetrics(Map)} adds.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.count());
        addCustomMetrics(metrics);
        return metrics;
    }

    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
