package org.observatory.runtime.actions;

import org.observatory.runtime.model.ResourceType;

/**
 * Exchanges resources between the submitting agent and a counterpart.
 * <p>
 * With the pool of the submitter's current region ({@code counterpartId} is {@code null}) the
 * exchange happens at once. With another CLAIMED agent it only opens a trade offer, which moves
 * nothing until that agent submits an {@link AcceptTradeAction} within the world's offer window.
 * Either side of the exchange may be zero, which turns the trade into a one-way transfer, but not
 * both.
 *
 * @param agentId         The agent giving {@code offerAmount} of {@code offerResource}.
 * @param counterpartId   The agent the offer is made to, or {@code null} for the region pool.
 * @param offerResource   Resource the submitter gives.
 * @param offerAmount     Quantity the submitter gives.
 * @param requestResource Resource the submitter receives.
 * @param requestAmount   Quantity the submitter receives.
 * @param submittedTick   Tick observed at submission.
 */
public record TradeAction(
    String agentId,
    String counterpartId,
    ResourceType offerResource,
    long offerAmount,
    ResourceType requestResource,
    long requestAmount,
    long submittedTick
) implements Action {

    public static TradeAction transfer(String agentId, String counterpartId, ResourceType resource, long amount, long submittedTick) {
        return new TradeAction(agentId, counterpartId, resource, amount, resource, 0, submittedTick);
    }

    @Override
    public ActionType type() {
        return ActionType.TRADE;
    }
}
