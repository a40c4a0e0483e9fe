package org.contagio.runtime;

import org.contagio.runtime.spi.IModelMeasure;

/**
 * Built-in model measures.
 */
public final class Measures {

    public static final String MEAN_FITNESS_NAME = "mean-fitness";
    public static final String ADAPTIVE_FRACTION_NAME = "adaptive-fraction";

    /**
     * Mean fitness over all agents, derived from their current behaviors.
     */
    public static final IModelMeasure MEAN_FITNESS = model -> {
        double sum = 0.0;
        for (int i = 0; i < model.size(); i++) {
            sum += model.agentAt(i).getFitness();
        }
        return sum / model.size();
    };

    /**
     * Share of agents currently performing the adaptive behavior.
     */
    public static final IModelMeasure ADAPTIVE_FRACTION = model -> {
        int adaptive = 0;
        for (int i = 0; i < model.size(); i++) {
            if (model.agentAt(i).isAdaptive()) {
                adaptive++;
            }
        }
        return (double) adaptive / model.size();
    };

    private Measures() {
    }
}
