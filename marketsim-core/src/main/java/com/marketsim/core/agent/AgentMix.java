package com.marketsim.core.agent;

/**
 * Head count per archetype for one symbol's population.
 */
public record AgentMix(int marketMakers, int noiseTraders, int informedTraders, int momentumTraders) {

    public static final AgentMix DEFAULT = new AgentMix(5, 20, 10, 5);

    public AgentMix {
        if (marketMakers < 0 || noiseTraders < 0 || informedTraders < 0 || momentumTraders < 0) {
            throw new IllegalArgumentException("agent counts cannot be negative");
        }
    }

    public int total() {
        return marketMakers + noiseTraders + informedTraders + momentumTraders;
    }

    public int count(Archetype archetype) {
        switch (archetype) {
            case MARKET_MAKER:
                return marketMakers;
            case NOISE:
                return noiseTraders;
            case INFORMED:
                return informedTraders;
            case MOMENTUM:
                return momentumTraders;
            default:
                throw new IllegalArgumentException("Unknown archetype: " + archetype);
        }
    }

    /**
     * Parses "makers,noise,informed,momentum", e.g. "5,20,10,5".
     */
    public static AgentMix fromString(String value) {
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid agent mix format: " + value);
        }
        try {
            return new AgentMix(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid agent mix format: " + value, e);
        }
    }
}
