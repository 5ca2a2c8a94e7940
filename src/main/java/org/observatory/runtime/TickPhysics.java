package org.observatory.runtime;

import org.observatory.runtime.internal.services.SeededRandomProvider;
import org.observatory.runtime.model.Agent;
import org.observatory.runtime.model.Region;
import org.observatory.runtime.model.ResourceType;
import org.observatory.runtime.model.WorldRules;
import org.observatory.runtime.model.WorldState;
import org.observatory.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Passive, tick-wide physics applied after all actions of a tick.
 * <p>
 * For every CLAIMED agent, in identifier order:
 * <ol>
 *   <li>upkeep is drained (never below zero),</li>
 *   <li>regeneration of {@code floor(rate * regionMultiplier)} is added, never lifting a quantity above its cap,</li>
 *   <li>one danger roll is drawn; a roll below the region's danger probability drains {@code dangerDamage} energy,</li>
 *   <li>an agent left without energy dies and its resources go to the region pool.</li>
 * </ol>
 * Exactly one roll is drawn per claimed agent whether or not the region is dangerous, so the
 * random stream of a tick depends only on the seed, the tick and the set of claimed agents.
 * PENDING agents are frozen and skipped.
 */
public final class TickPhysics {

    /**
     * Applies physics for {@code tick} to {@code state}.
     *
     * @return identifiers of agents that perished, in identifier order
     */
    public List<String> apply(WorldState state, long tick) {
        WorldRules rules = state.getRules();
        IRandomProvider rng = SeededRandomProvider.forTick(state.getSeed(), tick);
        List<String> casualties = new ArrayList<>();

        for (Agent agent : new ArrayList<>(state.agents())) {
            if (!agent.isClaimed()) {
                continue;
            }
            Region region = state.requireRegion(agent.getRegionId());

            rules.upkeep().forEach((type, amount) -> agent.getResources().drain(type, amount));
            regenerate(agent, region, rules);

            double roll = rng.nextDouble();
            if (roll < region.getDefinition().dangerProbability()) {
                agent.getResources().drain(ResourceType.ENERGY, rules.dangerDamage());
            }

            if (agent.getResources().get(ResourceType.ENERGY) == 0) {
                state.killAgent(agent, tick);
                casualties.add(agent.getId());
            }
        }
        return casualties;
    }

    private void regenerate(Agent agent, Region region, WorldRules rules) {
        double multiplier = region.getDefinition().resourceMultiplier();
        for (ResourceType type : ResourceType.values()) {
            long gain = (long) Math.floor(rules.regenerationRates().getOrDefault(type, 0.0) * multiplier);
            long headroom = rules.capOf(type) - agent.getResources().get(type);
            if (gain > 0 && headroom > 0) {
                agent.getResources().deposit(type, Math.min(gain, headroom));
            }
        }
    }
}
