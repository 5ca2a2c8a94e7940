package org.observatory.runtime;

import org.observatory.runtime.actions.ActionType;
import org.observatory.runtime.validation.RejectionReason;

/**
 * Diagnostic record of an action refused during a tick. Rejections never enter the ledger.
 */
public record RejectedAction(long tick, ActionType actionType, String agentId, RejectionReason reason, String detail) {
}
