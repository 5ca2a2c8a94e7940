package org.observatory.datapipeline.services;

import org.observatory.datapipeline.api.resources.IMonitorable;
import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.datapipeline.api.resources.OperationalError;
import org.observatory.datapipeline.api.services.IService;
import org.observatory.datapipeline.resources.RecentErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A service running its loop on a dedicated thread.
 * <p>
 * State moves STOPPED, RUNNING, PAUSED and back under {@link #start()}, {@link #pause()},
 * {@link #resume()} and {@link #stop()}. A runtime exception escaping {@link #run()} is logged at
 * ERROR without its stack trace and leaves the service in {@link State#ERROR}, from which it can
 * not be stopped or restarted. Failures the loop survives are recorded with
 * {@link #recordError(String, String, String)} and make the service unhealthy until cleared.
 */
public abstract class AbstractService implements IService, IMonitorable {

    private static final long STOP_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final String serviceName;
    private final Map<String, List<IResource>> resources;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final RecentErrors errors = new RecentErrors();
    private final Object pauseMonitor = new Object();
    private volatile Thread worker;

    /**
     * @param name      Service name, also used for the worker thread.
     * @param resources Resources bound to the service, by port name.
     */
    protected AbstractService(String name, Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.resources = resources;
    }

    /**
     * The service loop. Calls {@link #checkPause()} once per iteration and returns when the
     * service leaves RUNNING/PAUSED or the thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    @Override
    public final void start() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException("Service '" + serviceName + "' cannot start while " + state.get());
        }
        Thread thread = new Thread(this::runLoop, serviceName);
        worker = thread;
        thread.start();
        logStarted();
    }

    protected void logStarted() {
        log.info("{} started", getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State current = state.get();
        if (current != State.RUNNING && current != State.PAUSED) {
            throw new IllegalStateException("Service '" + serviceName + "' cannot stop while " + current);
        }
        // Interruption also ends a wait in checkPause().
        Thread thread = worker;
        thread.interrupt();
        try {
            thread.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for '{}' to stop", serviceName);
        }
        if (thread.isAlive()) {
            log.error("{} did not stop within {} ms, marking it ERROR", getClass().getSimpleName(), STOP_TIMEOUT_MS);
            state.set(State.ERROR);
            return;
        }
        log.debug("{} stopped in state {}", getClass().getSimpleName(), state.get());
    }

    @Override
    public final void pause() {
        if (!state.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException("Service '" + serviceName + "' cannot pause while " + state.get());
        }
        log.info("{} paused", getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        synchronized (pauseMonitor) {
            if (!state.compareAndSet(State.PAUSED, State.RUNNING)) {
                throw new IllegalStateException("Service '" + serviceName + "' cannot resume while " + state.get());
            }
            pauseMonitor.notifyAll();
        }
        log.info("{} resumed", getClass().getSimpleName());
    }

    @Override
    public void restart() {
        stop();
        start();
    }

    @Override
    public State getCurrentState() {
        return state.get();
    }

    /**
     * Blocks the service thread while the service is PAUSED.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseMonitor) {
            while (state.get() == State.PAUSED) {
                pauseMonitor.wait();
            }
        }
    }

    private void runLoop() {
        try {
            run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} interrupted", serviceName);
        } catch (RuntimeException e) {
            log.error("{} stopped with ERROR after {}: {}", getClass().getSimpleName(), e.getClass().getSimpleName(), e.getMessage());
            log.debug("Failure details", e);
            state.set(State.ERROR);
        } finally {
            state.compareAndSet(State.RUNNING, State.STOPPED);
            state.compareAndSet(State.PAUSED, State.STOPPED);
        }
    }

    /**
     * @return the resource bound to {@code port}, or empty if the port is unbound
     * @throws IllegalStateException if the port holds several resources or one of another type
     */
    protected <T extends IResource> Optional<T> boundResource(String port, Class<T> type) {
        List<IResource> bound = resources.getOrDefault(port, List.of());
        if (bound.isEmpty()) {
            return Optional.empty();
        }
        if (bound.size() > 1) {
            throw new IllegalStateException("Port '" + port + "' of service '" + serviceName + "' is bound to "
                + bound.size() + " resources, expected one");
        }
        IResource resource = bound.get(0);
        if (!type.isInstance(resource)) {
            throw new IllegalStateException("Port '" + port + "' of service '" + serviceName + "' is bound to a "
                + resource.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return Optional.of(type.cast(resource));
    }

    protected <T extends IResource> T requiredResource(String port, Class<T> type) {
        return boundResource(port, type).orElseThrow(() ->
            new IllegalStateException("Port '" + port + "' of service '" + serviceName + "' is not bound"));
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
        return state.get() != State.ERROR && errors.isEmpty();
    }

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
