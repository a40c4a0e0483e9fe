package org.contagio.runtime.spi;

import org.contagio.runtime.AgentBasedModel;

/**
 * A named scalar measured on the model after every step and stored in its
 * {@link org.contagio.runtime.StepSummary}.
 */
@FunctionalInterface
public interface IModelMeasure {

    /**
     * @param model The model after the step.
     * @return the measured value.
     */
    double measure(AgentBasedModel model);
}
