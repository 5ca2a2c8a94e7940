package org.observatory.runtime.actions;

/**
 * An agent's request to change the world, queued until the next tick boundary.
 * <p>
 * The set of variants is closed; dispatch happens on {@link #type()}.
 */
public sealed interface Action
    permits RegisterAction, ClaimAction, MoveAction, TradeAction, AcceptTradeAction, CommunicateAction,
            ForkAction, MergeAction, DieAction, ObserveAction {

    /**
     * @return the submitting agent
     */
    String agentId();

    /**
     * @return the tick the agent observed when submitting; informational only
     */
    long submittedTick();

    ActionType type();
}
