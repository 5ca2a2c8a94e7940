package org.observatory.runtime.actions;

/**
 * Promotes a PENDING agent to CLAIMED once its owner's claim has been verified upstream.
 *
 * @param agentId        The agent being claimed.
 * @param claimReference Opaque reference to the verified ownership claim.
 * @param submittedTick  Tick observed at submission.
 */
public record ClaimAction(String agentId, String claimReference, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.CLAIM;
    }
}
