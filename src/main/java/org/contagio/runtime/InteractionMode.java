package org.contagio.runtime;

import java.util.Locale;

import org.contagio.runtime.api.ConfigurationException;

/**
 * Which partners a dyad-dependent payoff is evaluated against when fitness is recomputed.
 */
public enum InteractionMode {
    /**
     * One neighbor drawn uniformly at random per agent and step.
     */
    ONE_RANDOM_PARTNER,
    /**
     * The mean payoff over all neighbors.
     */
    ALL_NEIGHBORS;

    /**
     * @param name "one-random-partner" or "all-neighbors" (dashes or underscores, any case).
     * @return the parsed mode.
     * @throws ConfigurationException if the name is unknown.
     */
    public static InteractionMode parse(String name) {
        try {
            return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown interaction mode: '" + name
                    + "'. Valid modes: one-random-partner, all-neighbors");
        }
    }
}
