package org.observatory.runtime.actions;

/**
 * Creates a new PENDING agent. The caller has already completed admission (for example a
 * proof-of-work check) before the action reaches the engine.
 *
 * @param agentId       Identifier for the new agent.
 * @param regionId      Region to spawn in, or {@code null} for the world's spawn region.
 * @param submittedTick Tick observed at submission.
 */
public record RegisterAction(String agentId, String regionId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.REGISTER;
    }
}
