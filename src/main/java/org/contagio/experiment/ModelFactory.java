package org.contagio.experiment;

import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.spi.IRandomProvider;

/**
 * Builds a fresh model for one parameter combination and replicate.
 * <p>
 * Called concurrently from the experiment runner's worker threads. Implementations must not
 * share mutable state between the models they return and must draw every random choice
 * (network, initial adopters) from the given stream.
 */
@FunctionalInterface
public interface ModelFactory {

    /**
     * @param combination The parameter values of this trial.
     * @param random The random stream of this trial.
     * @return a new model in its initial configuration.
     */
    AgentBasedModel create(ParameterCombination combination, IRandomProvider random);
}
