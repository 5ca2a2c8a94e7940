package org.observatory.runtime.model;

/**
 * Lifecycle status of an agent.
 * <p>
 * Transitions only move forward: {@code PENDING -> CLAIMED -> {DEAD | FORKED | MERGED}}.
 * The three terminal states are collectively called "retired".
 */
public enum AgentStatus {
    PENDING,
    CLAIMED,
    DEAD,
    FORKED,
    MERGED;

    /**
     * @return true for DEAD, FORKED and MERGED.
     */
    public boolean isRetired() {
        return this == DEAD || this == FORKED || this == MERGED;
    }

    /**
     * Checks whether moving from this status to {@code next} is a legal forward transition.
     *
     * @param next the requested status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(AgentStatus next) {
        return switch (this) {
            case PENDING -> next == CLAIMED;
            case CLAIMED -> next.isRetired();
            case DEAD, FORKED, MERGED -> false;
        };
    }
}
