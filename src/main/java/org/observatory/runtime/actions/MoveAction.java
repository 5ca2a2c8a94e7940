package org.observatory.runtime.actions;

/**
 * Moves an agent to another region at a distance-scaled cost.
 */
public record MoveAction(String agentId, String destinationRegionId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.MOVE;
    }
}
