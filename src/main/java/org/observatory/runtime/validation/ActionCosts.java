package org.observatory.runtime.validation;

import org.observatory.runtime.actions.Action;
import org.observatory.runtime.actions.ActionType;
import org.observatory.runtime.actions.CommunicateAction;
import org.observatory.runtime.actions.MoveAction;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.WorldRules;
import org.observatory.runtime.model.WorldState;

import java.util.EnumMap;
import java.util.Map;

/**
 * Prices actions against the world rules. Shared by validation and resolution so that the amount
 * checked is exactly the amount charged.
 */
public final class ActionCosts {

    private ActionCosts() {
        // Utility class
    }

    /**
     * Computes the fee charged to the submitting agent. The referenced regions and agents must
     * exist; callers validate references before pricing.
     */
    public static Map<ResourceType, Long> feeFor(WorldState state, Action action) {
        WorldRules rules = state.getRules();
        return switch (action.type()) {
            case MOVE -> {
                Region from = state.requireRegion(state.requireAgent(action.agentId()).getRegionId());
                Region to = state.requireRegion(((MoveAction) action).destinationRegionId());
                yield rules.distanceCost(ActionType.MOVE, from.distanceTo(to));
            }
            case COMMUNICATE -> {
                Region from = state.requireRegion(state.requireAgent(action.agentId()).getRegionId());
                Region to = state.requireRegion(state.requireAgent(((CommunicateAction) action).recipientId()).getRegionId());
                yield rules.distanceCost(ActionType.COMMUNICATE, from.distanceTo(to));
            }
            default -> rules.baseCost(action.type());
        };
    }

    /**
     * Adds a single quantity on top of a fee, producing the total the payer must hold. A total
     * beyond {@link Long#MAX_VALUE} is clamped to it, which no pool can cover.
     */
    public static Map<ResourceType, Long> plus(Map<ResourceType, Long> fee, ResourceType type, long amount) {
        Map<ResourceType, Long> total = new EnumMap<>(ResourceType.class);
        total.putAll(fee);
        if (amount > 0) {
            total.merge(type, amount, ActionCosts::saturatedSum);
        }
        return total;
    }

    // Both operands are non-negative: fees are validated by WorldRules, amounts by the caller.
    static long saturatedSum(long a, long b) {
        return b > Long.MAX_VALUE - a ? Long.MAX_VALUE : a + b;
    }
}
