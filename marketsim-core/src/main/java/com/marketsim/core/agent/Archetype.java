package com.marketsim.core.agent;

/**
 * The four kinds of simulated participant. The tag of an {@link Agent}
 * selects which {@link AgentBehavior} drives it.
 */
public enum Archetype {
    /** Two-sided quotes around the reference price, re-quoted every tick. */
    MARKET_MAKER,
    /** Occasional random orders. */
    NOISE,
    /** Trades with the price process's momentum once it is strong enough. */
    INFORMED,
    /** Chases the trend over a longer lookback of its own. */
    MOMENTUM
}
