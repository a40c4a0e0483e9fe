package org.contagio.runtime;

/**
 * Caller-supplied condition that ends a trial early with {@link TrialOutcome#STOPPED}.
 * <p>
 * Evaluated after every step that did not end in fixation. Predicates used by an experiment
 * runner are shared by concurrently running trials and must be stateless.
 */
@FunctionalInterface
public interface StoppingPredicate {

    /**
     * @param model The model after the step.
     * @param summary The summary of that step.
     * @return {@code true} to stop the trial.
     */
    boolean shouldStop(AgentBasedModel model, StepSummary summary);

    /**
     * @return a predicate that never fires.
     */
    static StoppingPredicate never() {
        return (model, summary) -> false;
    }

    /**
     * @param fraction the threshold in [0, 1].
     * @return a predicate that fires once the adaptive fraction reaches the threshold.
     */
    static StoppingPredicate adaptiveFractionAtLeast(double fraction) {
        return (model, summary) -> summary.adaptiveFraction() >= fraction;
    }
}
