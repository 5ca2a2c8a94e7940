package org.observatory.runtime.actions;

/**
 * Closed set of action kinds an agent can submit.
 * <p>
 * {@link #REGISTER} and {@link #CLAIM} are lifecycle actions fed by the registration and
 * claim-verification collaborators; all other kinds require a CLAIMED agent.
 */
public enum ActionType {
    REGISTER,
    CLAIM,
    MOVE,
    TRADE,
    ACCEPT_TRADE,
    COMMUNICATE,
    FORK,
    MERGE,
    DIE,
    OBSERVE
}
