package org.observatory.runtime.actions;

/**
 * Absorbs another agent into the submitter, which survives.
 */
public record MergeAction(String agentId, String absorbedAgentId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.MERGE;
    }
}
