package org.contagio.runtime;

import java.util.List;

/**
 * Output of a finished trial: the per-step time series, the terminal state and the step at
 * which it was reached.
 *
 * @param outcome the terminal state.
 * @param terminalStep the step index at termination.
 * @param timeSeries one summary per step, starting with the initial configuration at step 0.
 * @param failureMessage the error message for {@link TrialOutcome#FAILED}, otherwise {@code null}.
 */
public record TrialResult(TrialOutcome outcome, long terminalStep, List<StepSummary> timeSeries, String failureMessage) {

    public TrialResult {
        timeSeries = List.copyOf(timeSeries);
    }

    /**
     * @return the last recorded summary, or {@code null} if the trial failed before step 0 was recorded.
     */
    public StepSummary finalSummary() {
        return timeSeries.isEmpty() ? null : timeSeries.get(timeSeries.size() - 1);
    }

    /**
     * @return the adaptive fraction of the last recorded step, {@code NaN} if nothing was recorded.
     */
    public double finalAdaptiveFraction() {
        StepSummary last = finalSummary();
        return last == null ? Double.NaN : last.adaptiveFraction();
    }
}
