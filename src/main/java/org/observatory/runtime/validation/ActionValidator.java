package org.observatory.runtime.validation;

import org.observatory.runtime.actions.AcceptTradeAction;
import org.observatory.runtime.actions.Action;
import org.observatory.runtime.actions.ClaimAction;
import org.observatory.runtime.actions.CommunicateAction;
import org.observatory.runtime.actions.ForkAction;
import org.observatory.runtime.actions.MergeAction;
import org.observatory.runtime.actions.MoveAction;
import org.observatory.runtime.actions.RegisterAction;
import org.observatory.runtime.actions.TradeAction;
import org.observatory.runtime.model.Agent;
import org.observatory.runtime.model.AgentStatus;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourcePool;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.TradeOffer;
import org.observatory.runtime.model.WorldState;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.observatory.runtime.validation.RejectionReason.AGENT_NOT_CLAIMED;
import static org.observatory.runtime.validation.RejectionReason.AGENT_RETIRED;
import static org.observatory.runtime.validation.RejectionReason.INSUFFICIENT_RESOURCES;
import static org.observatory.runtime.validation.RejectionReason.INVALID_TARGET;
import static org.observatory.runtime.validation.RejectionReason.REGION_FULL;
import static org.observatory.runtime.validation.RejectionReason.UNKNOWN_AGENT;

/**
 * Decides whether an action may be applied to a given state.
 * <p>
 * Checks run in a fixed order so that an action violating several rules always reports the same
 * reason: submitter existence, retirement, claim status, targets and payload, resources, and
 * finally region capacity. A retired counterpart is reported as {@code AGENT_RETIRED}, a missing
 * or PENDING one as {@code INVALID_TARGET}.
 * <p>
 * The validator is a pure function of its arguments. It never mutates the state and never
 * performs I/O, so it is safe to call from any thread on a state nobody is mutating.
 */
public final class ActionValidator {

    public ValidationResult validate(WorldState state, Action action) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");

        if (action instanceof RegisterAction register) {
            return validateRegister(state, register);
        }

        Optional<Agent> submitter = state.findAgent(action.agentId());
        if (submitter.isEmpty()) {
            return ValidationResult.reject(UNKNOWN_AGENT, "No agent '" + action.agentId() + "'");
        }
        Agent agent = submitter.get();
        if (agent.isRetired()) {
            return ValidationResult.reject(AGENT_RETIRED, "Agent '" + agent.getId() + "' is " + agent.getStatus());
        }
        if (action instanceof ClaimAction claim) {
            return validateClaim(agent, claim);
        }
        if (!agent.isClaimed()) {
            return ValidationResult.reject(AGENT_NOT_CLAIMED, "Agent '" + agent.getId() + "' is " + agent.getStatus());
        }

        return switch (action.type()) {
            case MOVE -> validateMove(state, agent, (MoveAction) action);
            case TRADE -> validateTrade(state, agent, (TradeAction) action);
            case ACCEPT_TRADE -> validateAcceptTrade(state, agent, (AcceptTradeAction) action);
            case COMMUNICATE -> validateCommunicate(state, agent, (CommunicateAction) action);
            case FORK -> validateFork(state, agent, (ForkAction) action);
            case MERGE -> validateMerge(state, agent, (MergeAction) action);
            case DIE -> ValidationResult.accept();
            case OBSERVE -> requireFunds(agent.getResources(), ActionCosts.feeFor(state, action), agent.getId());
            case REGISTER, CLAIM -> throw new IllegalStateException("Lifecycle action dispatched as regular action: " + action);
        };
    }

    private ValidationResult validateRegister(WorldState state, RegisterAction action) {
        if (action.agentId() == null || action.agentId().isBlank()) {
            return ValidationResult.reject(INVALID_TARGET, "Agent id must not be blank");
        }
        if (state.findAgent(action.agentId()).isPresent()) {
            return ValidationResult.reject(INVALID_TARGET, "Agent '" + action.agentId() + "' already exists");
        }
        String regionId = action.regionId() != null ? action.regionId() : state.getRules().spawnRegion();
        Optional<Region> region = state.findRegion(regionId);
        if (region.isEmpty()) {
            return ValidationResult.reject(INVALID_TARGET, "No region '" + regionId + "'");
        }
        if (!region.get().hasSpareCapacity(1)) {
            return ValidationResult.reject(REGION_FULL, "Region '" + regionId + "' is full");
        }
        return ValidationResult.accept();
    }

    private ValidationResult validateClaim(Agent agent, ClaimAction action) {
        if (agent.getStatus() != AgentStatus.PENDING) {
            return ValidationResult.reject(INVALID_TARGET, "Agent '" + agent.getId() + "' is already " + agent.getStatus());
        }
        if (action.claimReference() == null || action.claimReference().isBlank()) {
            return ValidationResult.reject(INVALID_TARGET, "Claim reference must not be blank");
        }
        return ValidationResult.accept();
    }

    private ValidationResult validateMove(WorldState state, Agent agent, MoveAction action) {
        Optional<Region> destination = state.findRegion(action.destinationRegionId());
        if (destination.isEmpty()) {
            return ValidationResult.reject(INVALID_TARGET, "No region '" + action.destinationRegionId() + "'");
        }
        if (destination.get().getId().equals(agent.getRegionId())) {
            return ValidationResult.reject(INVALID_TARGET, "Agent '" + agent.getId() + "' is already in '" + agent.getRegionId() + "'");
        }
        ValidationResult funds = requireFunds(agent.getResources(), ActionCosts.feeFor(state, action), agent.getId());
        if (!funds.isAccepted()) {
            return funds;
        }
        if (!destination.get().hasSpareCapacity(1)) {
            return ValidationResult.reject(REGION_FULL, "Region '" + destination.get().getId() + "' is full");
        }
        return ValidationResult.accept();
    }

    private ValidationResult validateTrade(WorldState state, Agent agent, TradeAction action) {
        if (action.offerResource() == null || action.requestResource() == null) {
            return ValidationResult.reject(INVALID_TARGET, "Trade must name both resources");
        }
        if (action.offerAmount() < 0 || action.requestAmount() < 0
            || (action.offerAmount() == 0 && action.requestAmount() == 0)) {
            return ValidationResult.reject(INVALID_TARGET, "Trade amounts must be non-negative and not both zero");
        }
        if (action.counterpartId() != null) {
            Optional<ValidationResult> targetProblem = checkCounterpart(state, agent, action.counterpartId());
            if (targetProblem.isPresent()) {
                return targetProblem.get();
            }
        }

        Map<ResourceType, Long> submitterNeeds = ActionCosts.plus(ActionCosts.feeFor(state, action), action.offerResource(), action.offerAmount());
        ValidationResult funds = requireFunds(agent.getResources(), submitterNeeds, agent.getId());
        if (!funds.isAccepted() || action.counterpartId() != null) {
            // An offer to an agent takes nothing from it; acceptance checks the other side.
            return funds;
        }
        ResourcePool regionPool = state.requireRegion(agent.getRegionId()).getPool();
        if (regionPool.get(action.requestResource()) < action.requestAmount()) {
            return ValidationResult.reject(INSUFFICIENT_RESOURCES,
                "Region '" + agent.getRegionId() + "' cannot supply " + action.requestAmount() + " " + action.requestResource());
        }
        return ValidationResult.accept();
    }

    private ValidationResult validateAcceptTrade(WorldState state, Agent agent, AcceptTradeAction action) {
        Optional<TradeOffer> found = state.findTradeOffer(action.offerId());
        if (found.isEmpty()) {
            return ValidationResult.reject(INVALID_TARGET, "No open trade offer '" + action.offerId() + "'");
        }
        TradeOffer offer = found.get();
        if (!offer.recipientId().equals(agent.getId())) {
            return ValidationResult.reject(INVALID_TARGET, "Trade offer '" + offer.offerId() + "' is addressed to '" + offer.recipientId() + "'");
        }
        if (state.getTick() > offer.expiresAtTick()) {
            return ValidationResult.reject(INVALID_TARGET, "Trade offer '" + offer.offerId() + "' expired at tick " + offer.expiresAtTick());
        }
        Optional<ValidationResult> offererProblem = checkCounterpart(state, agent, offer.offererId());
        if (offererProblem.isPresent()) {
            return offererProblem.get();
        }
        ResourcePool offererPool = state.requireAgent(offer.offererId()).getResources();
        if (offererPool.get(offer.offerResource()) < offer.offerAmount()) {
            return ValidationResult.reject(INSUFFICIENT_RESOURCES,
                "Agent '" + offer.offererId() + "' can no longer supply " + offer.offerAmount() + " " + offer.offerResource());
        }
        Map<ResourceType, Long> accepterNeeds = ActionCosts.plus(ActionCosts.feeFor(state, action), offer.requestResource(), offer.requestAmount());
        return requireFunds(agent.getResources(), accepterNeeds, agent.getId());
    }

    private ValidationResult validateCommunicate(WorldState state, Agent agent, CommunicateAction action) {
        Optional<ValidationResult> targetProblem = checkCounterpart(state, agent, action.recipientId());
        if (targetProblem.isPresent()) {
            return targetProblem.get();
        }
        if (action.content() == null) {
            return ValidationResult.reject(INVALID_TARGET, "Message content must not be null");
        }
        return requireFunds(agent.getResources(), ActionCosts.feeFor(state, action), agent.getId());
    }

    private ValidationResult validateFork(WorldState state, Agent agent, ForkAction action) {
        if (action.sharePercent() < 1 || action.sharePercent() > 99) {
            return ValidationResult.reject(INVALID_TARGET, "Fork share must be within 1..99: " + action.sharePercent());
        }
        if (state.findAgent(action.firstChildId()).isPresent() || state.findAgent(action.secondChildId()).isPresent()) {
            return ValidationResult.reject(INVALID_TARGET, "Child identifiers of '" + agent.getId() + "' are already taken");
        }
        ValidationResult funds = requireFunds(agent.getResources(), ActionCosts.feeFor(state, action), agent.getId());
        if (!funds.isAccepted()) {
            return funds;
        }
        // Parent leaves, two children arrive.
        if (!state.requireRegion(agent.getRegionId()).hasSpareCapacity(1)) {
            return ValidationResult.reject(REGION_FULL, "Region '" + agent.getRegionId() + "' has no room for a second child");
        }
        return ValidationResult.accept();
    }

    private ValidationResult validateMerge(WorldState state, Agent agent, MergeAction action) {
        Optional<ValidationResult> targetProblem = checkCounterpart(state, agent, action.absorbedAgentId());
        if (targetProblem.isPresent()) {
            return targetProblem.get();
        }
        return requireFunds(agent.getResources(), ActionCosts.feeFor(state, action), agent.getId());
    }

    private Optional<ValidationResult> checkCounterpart(WorldState state, Agent agent, String counterpartId) {
        if (counterpartId == null) {
            return Optional.of(ValidationResult.reject(INVALID_TARGET, "No counterpart given"));
        }
        if (counterpartId.equals(agent.getId())) {
            return Optional.of(ValidationResult.reject(INVALID_TARGET, "Agent '" + agent.getId() + "' cannot target itself"));
        }
        Optional<Agent> counterpart = state.findAgent(counterpartId);
        if (counterpart.isEmpty()) {
            return Optional.of(ValidationResult.reject(INVALID_TARGET, "No agent '" + counterpartId + "'"));
        }
        if (counterpart.get().isRetired()) {
            return Optional.of(ValidationResult.reject(AGENT_RETIRED,
                "Agent '" + counterpartId + "' is " + counterpart.get().getStatus()));
        }
        if (!counterpart.get().isClaimed()) {
            return Optional.of(ValidationResult.reject(INVALID_TARGET,
                "Agent '" + counterpartId + "' is " + counterpart.get().getStatus()));
        }
        return Optional.empty();
    }

    private ValidationResult requireFunds(ResourcePool pool, Map<ResourceType, Long> needed, String agentId) {
        if (!pool.covers(needed)) {
            return ValidationResult.reject(INSUFFICIENT_RESOURCES, "Agent '" + agentId + "' holds " + pool + ", needs " + needed);
        }
        return ValidationResult.accept();
    }
}
