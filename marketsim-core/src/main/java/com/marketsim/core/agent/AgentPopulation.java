package com.marketsim.core.agent;

import com.marketsim.api.Fill;
import com.marketsim.api.Side;
import com.marketsim.core.MatchResult;
import com.marketsim.core.execution.OrderIntent;
import org.agrona.collections.Long2LongHashMap;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * <h1>Agent Population of One Symbol</h1>
 *
 * <p>
 * Holds the agents in ascending id order and the behavior of each archetype.
 * {@link #act} lets every agent decide once per tick, in id order, all drawing
 * from the symbol's single random source, so the intents of a tick are a pure
 * function of the seed and the market history.
 * </p>
 *
 * <h2>Ownership routing</h2>
 * <p>
 * The book knows nothing about agents. The population keeps an order id to
 * agent id index for resting agent orders and uses it to book the passive side
 * of each fill; the aggressive side is booked from the intent that produced the
 * order.
 * </p>
 */
public class AgentPopulation {

    private static final long NO_OWNER = -1L;

    private final List<Agent> agents;
    private final Map<Archetype, AgentBehavior> behaviors;
    private final Long2LongHashMap orderOwners = new Long2LongHashMap(NO_OWNER);
    private final List<OrderIntent> scratch = new ArrayList<>();

    public AgentPopulation(List<Agent> agents, Map<Archetype, AgentBehavior> behaviors) {
        for (int i = 0; i < agents.size(); i++) {
            Agent agent = agents.get(i);
            if (agent.id() != i) {
                throw new IllegalArgumentException("agents must be numbered 0..n-1 in order, found " + agent.id()
                    + " at " + i);
            }
            if (!behaviors.containsKey(agent.archetype())) {
                throw new IllegalArgumentException("no behavior for " + agent.archetype());
            }
        }
        this.agents = List.copyOf(agents);
        this.behaviors = new EnumMap<>(behaviors);
    }

    public static Map<Archetype, AgentBehavior> defaultBehaviors() {
        Map<Archetype, AgentBehavior> behaviors = new EnumMap<>(Archetype.class);
        behaviors.put(Archetype.MARKET_MAKER, new MarketMakerBehavior());
        behaviors.put(Archetype.NOISE, new NoiseTraderBehavior());
        behaviors.put(Archetype.INFORMED, new InformedTraderBehavior());
        behaviors.put(Archetype.MOMENTUM, new MomentumTraderBehavior());
        return behaviors;
    }

    /**
     * Builds a population with the default behaviors: market makers first, then
     * noise, informed and momentum traders. Market makers draw their spread
     * multiplier in [0.8, 1.6) from {@code random}.
     */
    public static AgentPopulation create(AgentMix mix, RandomGenerator random) {
        Map<Archetype, AgentBehavior> behaviors = defaultBehaviors();
        int memoryLength = ((MomentumTraderBehavior) behaviors.get(Archetype.MOMENTUM)).memoryLength();

        List<Agent> agents = new ArrayList<>(mix.total());
        int id = 0;
        for (Archetype archetype : Archetype.values()) {
            for (int i = 0; i < mix.count(archetype); i++) {
                double multiplier = archetype == Archetype.MARKET_MAKER ? 0.8 + 0.8 * random.nextDouble() : 1.0;
                int memory = archetype == Archetype.MOMENTUM ? memoryLength : 1;
                agents.add(new Agent(id++, archetype, multiplier, memory));
            }
        }
        return new AgentPopulation(agents, behaviors);
    }

    /**
     * Lets every agent act once, in ascending id order.
     *
     * @return the tick's intents in the order they were decided
     */
    public List<OrderIntent> act(AgentContext context, RandomGenerator random) {
        List<OrderIntent> intents = new ArrayList<>();
        for (Agent agent : agents) {
            scratch.clear();
            behaviors.get(agent.archetype()).act(agent, context, random, scratch);
            intents.addAll(scratch);
        }
        return intents;
    }

    /**
     * Books the outcome of an agent's released order: its own fills as
     * aggressor, and ownership of any resting remainder.
     */
    public void onOrderReleased(int agentId, MatchResult result, long tick) {
        Agent agent = agent(agentId);
        if (agent == null) {
            return;
        }
        for (Fill fill : result.fills()) {
            agent.applyFill(fill.side(), fill.quantity(), fill.price());
        }
        if (result.restingQuantity() > 0) {
            orderOwners.put(result.orderId(), agentId);
            agent.orderOpened(result.orderId(), tick);
        }
    }

    /**
     * Books the passive side of a fill if the consumed order belongs to an
     * agent. Must run before the consumed order's removal is reported.
     */
    public void onPassiveFill(Fill fill) {
        long owner = orderOwners.get(fill.counterOrderId());
        if (owner != NO_OWNER) {
            agents.get((int) owner).applyFill(Side.opposite(fill.side()), fill.quantity(), fill.price());
        }
    }

    /**
     * A resting order left the book, filled or cancelled.
     */
    public void onOrderRemoved(long orderId) {
        long owner = orderOwners.remove(orderId);
        if (owner != NO_OWNER) {
            agents.get((int) owner).orderClosed(orderId);
        }
    }

    /**
     * @return owning agent id, or -1 for an order no agent owns
     */
    public int ownerOf(long orderId) {
        return (int) orderOwners.get(orderId);
    }

    public Agent agent(int agentId) {
        if (agentId < 0 || agentId >= agents.size()) {
            return null;
        }
        return agents.get(agentId);
    }

    public List<Agent> agents() {
        return agents;
    }

    public int size() {
        return agents.size();
    }

    /**
     * Sum of all agents' positions. Trades between agents net to zero, so this
     * is minus the position the external flow accumulated against them.
     */
    public long netPosition() {
        long net = 0;
        for (Agent agent : agents) {
            net += agent.position();
        }
        return net;
    }
}
