package org.contagio.runtime.spi;

import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.model.Network;

/**
 * Read-only view of the population state a learning decision is computed from.
 * <p>
 * Under synchronous update this is the start-of-step snapshot: no decision taken in the
 * current step is visible through it. Under sequential update it reflects every decision
 * already committed in the current step.
 */
public interface PopulationView {

    /**
     * @return the network the population lives on.
     */
    Network network();

    /**
     * @param index an agent index.
     * @return the behavior of that agent.
     */
    Behavior behaviorAt(int index);

    /**
     * @param index an agent index.
     * @return the fitness of that agent, as computed at the start of the step.
     */
    double fitnessAt(int index);
}
