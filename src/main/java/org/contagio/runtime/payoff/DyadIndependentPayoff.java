package org.contagio.runtime.payoff;

import org.contagio.runtime.api.InvalidPayoffSpecException;
import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.spi.IDyadIndependentPayoff;

import com.typesafe.config.Config;

/**
 * Per-behavior base fitness, independent of any interaction partner.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * payoff {
 *   type = "dyad-independent"
 *   legacy = 1.0
 *   adaptive = 1.2
 * }
 * }</pre>
 * Both values default to {@code 1.0} (neutral fitness).
 */
public class DyadIndependentPayoff implements IDyadIndependentPayoff {

    private final double[] fitness = {1.0, 1.0};

    public DyadIndependentPayoff() {
    }

    /**
     * Creates a payoff with the given per-behavior fitness.
     *
     * @param legacyFitness fitness of legacy agents.
     * @param adaptiveFitness fitness of adaptive agents.
     */
    public DyadIndependentPayoff(double legacyFitness, double adaptiveFitness) {
        set(Behavior.LEGACY, legacyFitness);
        set(Behavior.ADAPTIVE, adaptiveFitness);
    }

    @Override
    public void initialize(Config options) {
        if (options.hasPath("legacy")) {
            set(Behavior.LEGACY, options.getDouble("legacy"));
        }
        if (options.hasPath("adaptive")) {
            set(Behavior.ADAPTIVE, options.getDouble("adaptive"));
        }
    }

    @Override
    public double payoff(Behavior behavior) {
        return fitness[behavior.ordinal()];
    }

    private void set(Behavior behavior, double value) {
        if (value < 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidPayoffSpecException("Fitness of " + behavior + " must be a finite non-negative value, got " + value);
        }
        fitness[behavior.ordinal()] = value;
    }

    @Override
    public String toString() {
        return "DyadIndependentPayoff{legacy=" + fitness[0] + ", adaptive=" + fitness[1] + "}";
    }
}
