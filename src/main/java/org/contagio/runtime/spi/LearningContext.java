package org.contagio.runtime.spi;

import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.model.Network;

/**
 * Everything a learning strategy may read when deciding for one focal agent.
 *
 * @param focalIndex the index of the learner.
 * @param population the population state the decision is computed from.
 * @param adoptionRates the adoption-rate gate (α and dyadic overrides).
 */
public record LearningContext(int focalIndex, PopulationView population, AdoptionRates adoptionRates) {

    public Network network() {
        return population.network();
    }

    public int degree() {
        return population.network().degree(focalIndex);
    }

    public int neighborAt(int k) {
        return population.network().neighborAt(focalIndex, k);
    }

    public boolean isAdaptive(int index) {
        return population.behaviorAt(index) == Behavior.ADAPTIVE;
    }

    /**
     * @param teacherIndex the index of a potential teacher.
     * @return the adoption rate that applies when the focal agent learns from this teacher.
     */
    public double rateFrom(int teacherIndex) {
        Network network = population.network();
        return adoptionRates.rateFor(network.idOf(focalIndex), network.idOf(teacherIndex));
    }
}
