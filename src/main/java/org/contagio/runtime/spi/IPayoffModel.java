package org.contagio.runtime.spi;

import com.typesafe.config.Config;

/**
 * Service Provider Interface for payoff structures.
 * <p>
 * A payoff model is either dyad-independent ({@link IDyadIndependentPayoff}, fitness depends on
 * the agent's own behavior only) or dyad-dependent ({@link IDyadicPayoff}, fitness depends on the
 * behaviors of both members of an interacting pair). Implementations are pure functions of their
 * inputs; the model writes results into the agents' fitness caches.
 * <p>
 * Implementations must provide a public no-arg constructor.
 */
public interface IPayoffModel {

    /**
     * Initializes the payoff model from its HOCON options.
     *
     * @param options The options block; an empty Config if none were given.
     * @throws org.contagio.runtime.api.InvalidPayoffSpecException if the table is incomplete or invalid.
     */
    void initialize(Config options);
}
