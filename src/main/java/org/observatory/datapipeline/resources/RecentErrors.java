package org.observatory.datapipeline.resources;

import org.observatory.datapipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Transient errors of one component, newest last. Holds at most {@value #CAPACITY} entries and
 * drops the oldest beyond that. Safe for concurrent use.
 */
public final class RecentErrors {

    static final int CAPACITY = 1000;

    private final ConcurrentLinkedDeque<OperationalError> entries = new ConcurrentLinkedDeque<>();

    public void add(String errorType, String message, String details) {
        entries.addLast(new OperationalError(Instant.now(), errorType, message, details));
        while (entries.size() > CAPACITY) {
            entries.pollFirst();
        }
    }

    public List<OperationalError> list() {
        return new ArrayList<>(entries);
    }

    public int count() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }
}
