package org.observatory.runtime.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * One committed state transition as stored in the ledger.
 * <p>
 * Readers must order events by {@code sequence} only. The {@code timestamp} is wall-clock
 * milliseconds for operators and is never consulted when applying the event.
 *
 * @param sequence  Strictly increasing, gap-free sequence number starting at 0.
 * @param tick      Tick the event belongs to.
 * @param type      Event type.
 * @param agentIds  Agents the event concerns, the acting agent first.
 * @param payload   Typed payload (see {@link EventPayloads}) in tree form.
 * @param timestamp Wall-clock creation time in epoch milliseconds.
 */
public record LedgerEvent(
    long sequence,
    long tick,
    EventType type,
    List<String> agentIds,
    JsonNode payload,
    long timestamp
) {
    public LedgerEvent {
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(payload, "Event payload cannot be null");
        agentIds = agentIds != null ? List.copyOf(agentIds) : List.of();
    }

    public boolean concerns(String agentId) {
        return agentIds.contains(agentId);
    }
}
