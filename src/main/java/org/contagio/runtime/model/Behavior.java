package org.contagio.runtime.model;

import java.util.Locale;

import org.contagio.runtime.api.ConfigurationException;

/**
 * The two behaviors of the diffusion model.
 * <p>
 * {@link #LEGACY} is the incumbent behavior every population starts from; {@link #ADAPTIVE}
 * is the behavior whose spread is studied. Dyad-dependent payoff tables reuse the same two
 * states as roles: cooperate/defect for correlative coordination and the two complementary
 * roles for complementary coordination.
 */
public enum Behavior {
    LEGACY,
    ADAPTIVE;

    private static final Behavior[] VALUES = values();

    /**
     * Returns the behavior with the given ordinal without allocating.
     *
     * @param ordinal the ordinal (0 or 1).
     * @return the behavior.
     */
    public static Behavior ofOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    /**
     * @return the opposite behavior.
     */
    public Behavior other() {
        return this == LEGACY ? ADAPTIVE : LEGACY;
    }

    /**
     * Parses a behavior name case-insensitively.
     *
     * @param name "legacy" or "adaptive" in any case.
     * @return the parsed behavior.
     * @throws ConfigurationException if the name is unknown.
     */
    public static Behavior parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown behavior: '" + name + "'. Valid behaviors: legacy, adaptive");
        }
    }
}
