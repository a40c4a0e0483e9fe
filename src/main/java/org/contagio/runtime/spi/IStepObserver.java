package org.contagio.runtime.spi;

import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.StepSummary;

/**
 * Callback invoked once after every completed model step.
 * <p>
 * Observers run sequentially in registration order on the thread that advances the model.
 * They may read the model but must not change agent state.
 */
@FunctionalInterface
public interface IStepObserver {

    /**
     * @param model The model that just completed a step.
     * @param summary The summary of that step.
     */
    void onStep(AgentBasedModel model, StepSummary summary);
}
