package org.observatory.runtime.actions;

/**
 * Looks around the agent's current region.
 */
public record ObserveAction(String agentId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.OBSERVE;
    }
}
