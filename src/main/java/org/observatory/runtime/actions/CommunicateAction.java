package org.observatory.runtime.actions;

/**
 * Delivers a message to another agent. Content arrives already noised by the messaging
 * collaborator; the engine only charges for delivery and records it.
 */
public record CommunicateAction(String agentId, String recipientId, String content, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.COMMUNICATE;
    }
}
