package org.contagio.experiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.contagio.runtime.TrialOutcome;

/**
 * Result of one trial of a sweep, identified by (combination key, replicate).
 *
 * @param combinationIndex the combination's position in grid order.
 * @param combinationKey the canonical combination key, see {@link ParameterCombination#key()}.
 * @param parameters the parameter values of the combination.
 * @param replicate the replicate index within the combination.
 * @param outcome the terminal state of the trial.
 * @param terminalStep the step at termination.
 * @param finalAdaptiveFraction the adaptive fraction at termination, {@code NaN} if unknown.
 * @param failureMessage the failure message of a {@link TrialOutcome#FAILED} trial, otherwise {@code null}.
 */
public record ExperimentRecord(int combinationIndex, String combinationKey, Map<String, Object> parameters,
                               int replicate, TrialOutcome outcome, long terminalStep,
                               double finalAdaptiveFraction, String failureMessage) {

    public ExperimentRecord {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * @return {@code true} if the trial fixated on the adaptive behavior.
     */
    public boolean success() {
        return outcome == TrialOutcome.FIXATED_ADAPTIVE;
    }

    /**
     * @return the identity of this record within a sweep.
     */
    public Key key() {
        return new Key(combinationKey, replicate);
    }

    /**
     * @param index the combination index in the current grid.
     * @return this record with another combination index.
     */
    public ExperimentRecord withCombinationIndex(int index) {
        if (index == combinationIndex) {
            return this;
        }
        return new ExperimentRecord(index, combinationKey, parameters, replicate, outcome, terminalStep,
                finalAdaptiveFraction, failureMessage);
    }

    /**
     * Identity of a record: (combination key, replicate).
     */
    public record Key(String combinationKey, int replicate) {}
}
