package com.marketsim.core.agent;

import com.marketsim.core.execution.OrderIntent;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Decision rule of one {@link Archetype}. Stateless: everything an agent
 * remembers lives on its {@link Agent}.
 */
public interface AgentBehavior {

    Archetype archetype();

    /**
     * Decides this tick's intents for {@code agent} and appends them to
     * {@code out}. Draws only from {@code random}.
     */
    void act(Agent agent, AgentContext context, RandomGenerator random, List<OrderIntent> out);
}
