package org.contagio.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.contagio.runtime.model.Behavior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one {@link AgentBasedModel} until a terminal state and records its time series.
 * <p>
 * The initial configuration is recorded as step 0. After each step the first matching rule
 * decides the state: every agent shares one behavior → the matching fixation; the stopping
 * predicate fires → {@link TrialOutcome#STOPPED}; the step count reaches {@code maxSteps} →
 * {@link TrialOutcome#TIMED_OUT}; otherwise the trial keeps running. A population that starts
 * fixated, or a {@code maxSteps} of 0, terminates at step 0. Any runtime exception raised by
 * the model ends the trial as {@link TrialOutcome#FAILED}.
 * <p>
 * {@link #run()} executes at most once; later calls return the stored result.
 */
public class Trial {
    private static final Logger LOG = LoggerFactory.getLogger(Trial.class);

    private final AgentBasedModel model;
    private final long maxSteps;
    private final StoppingPredicate stoppingPredicate;
    private final List<StepSummary> timeSeries = new ArrayList<>();
    private TrialResult result;

    /**
     * @param model The model to drive, in its initial configuration.
     * @param maxSteps The step bound, must be &gt;= 0.
     * @param stoppingPredicate The caller's early-stop condition.
     */
    public Trial(AgentBasedModel model, long maxSteps, StoppingPredicate stoppingPredicate) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0, got " + maxSteps);
        }
        this.model = model;
        this.maxSteps = maxSteps;
        this.stoppingPredicate = stoppingPredicate;
    }

    public Trial(AgentBasedModel model, long maxSteps) {
        this(model, maxSteps, StoppingPredicate.never());
    }

    public AgentBasedModel getModel() {
        return model;
    }

    public boolean isFinished() {
        return result != null;
    }

    /**
     * Runs the trial to a terminal state.
     *
     * @return the result; the same instance on every call.
     */
    public TrialResult run() {
        if (result != null) {
            return result;
        }
        try {
            StepSummary summary = model.summarize();
            timeSeries.add(summary);
            TrialOutcome outcome = evaluate(summary, false);
            while (outcome == null) {
                summary = model.advanceOneStep();
                timeSeries.add(summary);
                outcome = evaluate(summary, true);
            }
            result = new TrialResult(outcome, summary.step(), timeSeries, null);
        } catch (RuntimeException e) {
            LOG.debug("Trial failed at step {}: {}", model.getStep(), e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = new TrialResult(TrialOutcome.FAILED, model.getStep(), timeSeries, message);
        }
        LOG.debug("Trial finished: {} at step {}", result.outcome(), result.terminalStep());
        return result;
    }

    private TrialOutcome evaluate(StepSummary summary, boolean afterStep) {
        Optional<Behavior> fixated = summary.fixatedBehavior();
        if (fixated.isPresent()) {
            return fixated.get() == Behavior.ADAPTIVE ? TrialOutcome.FIXATED_ADAPTIVE : TrialOutcome.FIXATED_LEGACY;
        }
        if (afterStep && stoppingPredicate.shouldStop(model, summary)) {
            return TrialOutcome.STOPPED;
        }
        if (summary.step() >= maxSteps) {
            return TrialOutcome.TIMED_OUT;
        }
        return null;
    }
}
