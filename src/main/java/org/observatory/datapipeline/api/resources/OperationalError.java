package org.observatory.datapipeline.api.resources;

import java.time.Instant;

/**
 * Represents a transient operational error that occurred within a component.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "SNAPSHOT_FAILED", "REJECTION_LOG_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
