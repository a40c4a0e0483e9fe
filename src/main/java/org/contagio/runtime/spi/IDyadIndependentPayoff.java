package org.contagio.runtime.spi;

import org.contagio.runtime.model.Behavior;

/**
 * A payoff model in which an agent's fitness depends on its own behavior only.
 */
public interface IDyadIndependentPayoff extends IPayoffModel {

    /**
     * @param behavior the agent's behavior.
     * @return the non-negative fitness.
     */
    double payoff(Behavior behavior);
}
