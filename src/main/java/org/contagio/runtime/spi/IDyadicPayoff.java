package org.contagio.runtime.spi;

import org.contagio.runtime.model.Behavior;

/**
 * A payoff model in which an agent's fitness depends on its own behavior and the behavior of
 * the partner it interacts with.
 */
public interface IDyadicPayoff extends IPayoffModel {

    /**
     * @param own the focal agent's behavior.
     * @param partner the interaction partner's behavior.
     * @return the non-negative fitness of the focal agent.
     */
    double payoff(Behavior own, Behavior partner);
}
