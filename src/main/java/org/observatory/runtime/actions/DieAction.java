package org.observatory.runtime.actions;

public record DieAction(String agentId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.DIE;
    }
}
