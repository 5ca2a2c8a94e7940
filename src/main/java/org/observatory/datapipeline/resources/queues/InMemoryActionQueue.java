package org.observatory.datapipeline.resources.queues;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.observatory.datapipeline.api.resources.queues.IActionQueueResource;
import org.observatory.datapipeline.api.resources.queues.QueuedAction;
import org.observatory.datapipeline.resources.AbstractResource;
import org.observatory.runtime.actions.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A thread-safe, in-memory, bounded action buffer with an atomic swap for the tick scheduler.
 * <p>
 * Producers share the read side of a {@link ReentrantReadWriteLock} while appending to the
 * current buffer; {@link #drainAll()} takes the write side to replace the buffer. A producer
 * therefore either finishes its append before the swap (its action is in the drained batch) or
 * starts after it (its action lands in the next tick). No action can slip into a buffer that has
 * already been handed out.
 */
public class InMemoryActionQueue extends AbstractResource implements IActionQueueResource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryActionQueue.class);

    private final int capacity;
    private final ReentrantReadWriteLock swapLock = new ReentrantReadWriteLock();
    private ConcurrentLinkedQueue<QueuedAction> buffer = new ConcurrentLinkedQueue<>();
    private final AtomicInteger bufferedCount = new AtomicInteger();
    private final AtomicLong arrivalCounter = new AtomicLong();
    private final AtomicLong offeredTotal = new AtomicLong();
    private final AtomicLong refusedTotal = new AtomicLong();
    private final AtomicLong drainedTotal = new AtomicLong();

    /**
     * @param name    The name of the resource.
     * @param options Queue options; {@code capacity} (default 10000) bounds the actions buffered per tick.
     * @throws IllegalArgumentException if the configuration is invalid (e.g., non-positive capacity).
     */
    public InMemoryActionQueue(String name, Config options) {
        super(name);
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("capacity", 10000)));
        try {
            this.capacity = finalConfig.getInt("capacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryActionQueue '" + name + "'", e);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive for resource '" + name + "'.");
        }
    }

    @Override
    public boolean offer(Action action) {
        Objects.requireNonNull(action, "action cannot be null");
        swapLock.readLock().lock();
        try {
            if (bufferedCount.incrementAndGet() > capacity) {
                bufferedCount.decrementAndGet();
                refusedTotal.incrementAndGet();
                log.debug("Queue '{}' full, refusing {} from '{}'", resourceName, action.type(), action.agentId());
                return false;
            }
            buffer.add(new QueuedAction(arrivalCounter.getAndIncrement(), action));
            offeredTotal.incrementAndGet();
            return true;
        } finally {
            swapLock.readLock().unlock();
        }
    }

    @Override
    public List<QueuedAction> drainAll() {
        ConcurrentLinkedQueue<QueuedAction> drained;
        swapLock.writeLock().lock();
        try {
            drained = buffer;
            buffer = new ConcurrentLinkedQueue<>();
            bufferedCount.set(0);
        } finally {
            swapLock.writeLock().unlock();
        }
        List<QueuedAction> batch = new ArrayList<>(drained);
        batch.sort(QueuedAction.PROCESSING_ORDER);
        drainedTotal.addAndGet(batch.size());
        return batch;
    }

    @Override
    public int size() {
        return bufferedCount.get();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public ResourceState getState() {
        return size() >= capacity ? ResourceState.WAITING : ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("capacity", capacity);
        metrics.put("current_size", size());
        metrics.put("offered_total", offeredTotal.get());
        metrics.put("refused_total", refusedTotal.get());
        metrics.put("drained_total", drainedTotal.get());
    }
}
