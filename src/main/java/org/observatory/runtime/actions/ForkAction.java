package org.observatory.runtime.actions;

/**
 * Splits an agent into two children.
 *
 * @param agentId       The parent, retired as FORKED.
 * @param sharePercent  Percentage (1..99) of the parent's remaining resources given to the first child.
 * @param submittedTick Tick observed at submission.
 */
public record ForkAction(String agentId, int sharePercent, long submittedTick) implements Action {

    public String firstChildId() {
        return agentId + ".1";
    }

    public String secondChildId() {
        return agentId + ".2";
    }
    @Override
    public ActionType type() {
        return ActionType.FORK;
    }
}
