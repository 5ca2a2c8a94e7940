package org.observatory.runtime.actions;

/**
 * Accepts an open trade offer addressed to the submitting agent and executes the exchange.
 *
 * @param agentId       The recipient named in the offer.
 * @param offerId       Identifier from the TRADE_OFFERED ledger event.
 * @param submittedTick Tick observed at submission.
 */
public record AcceptTradeAction(String agentId, String offerId, long submittedTick) implements Action {
    @Override
    public ActionType type() {
        return ActionType.ACCEPT_TRADE;
    }
}
