package org.contagio.runtime.learning;

import java.util.OptionalInt;

import org.contagio.runtime.api.RuntimeInvariantException;
import org.contagio.runtime.spi.ILearningStrategy;
import org.contagio.runtime.spi.IRandomProvider;
import org.contagio.runtime.spi.LearningContext;

import com.typesafe.config.Config;

/**
 * Payoff-biased social learning: the learner copies a teacher drawn with probability
 * proportional to fitness.
 * <p>
 * The teacher pool is the learner's neighborhood, plus the learner itself when
 * {@code include-self} is set (the default). Drawing oneself means keeping the current
 * behavior. When every candidate has zero fitness the draw falls back to uniform selection.
 * <p>
 * For a learner {@code i} with pool {@code T}, adaptive neighbors {@code m} and adoption
 * rates {@code r(i,j)}:
 * <pre>
 *   P(adopt) = sum_{j in m} f_j * r(i,j) / sum_{k in T} f_k
 * </pre>
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * learning {
 *   strategy = "success-biased"
 *   options { include-self = true }
 * }
 * }</pre>
 */
public class SuccessBiasedLearning implements ILearningStrategy {

    private boolean includeSelf = true;

    @Override
    public void initialize(Config options) {
        if (options.hasPath("include-self")) {
            this.includeSelf = options.getBoolean("include-self");
        }
    }

    public boolean isIncludeSelf() {
        return includeSelf;
    }

    @Override
    public OptionalInt selectTeacher(LearningContext context, IRandomProvider random) {
        int degree = context.degree();
        int poolSize = degree + (includeSelf ? 1 : 0);
        if (poolSize == 0) {
            return OptionalInt.empty();
        }
        double total = totalFitness(context);
        if (total <= 0.0) {
            return OptionalInt.of(candidateAt(context, random.nextInt(poolSize)));
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        int lastPositive = -1;
        for (int k = 0; k < poolSize; k++) {
            int candidate = candidateAt(context, k);
            double fitness = context.population().fitnessAt(candidate);
            if (fitness <= 0.0) {
                continue;
            }
            cumulative += fitness;
            lastPositive = candidate;
            if (target < cumulative) {
                return OptionalInt.of(candidate);
            }
        }
        // Rounding can leave target marginally above the final cumulative sum
        return OptionalInt.of(lastPositive);
    }

    @Override
    public double adoptionProbability(LearningContext context) {
        int degree = context.degree();
        int poolSize = degree + (includeSelf ? 1 : 0);
        if (poolSize == 0) {
            return 0.0;
        }
        double total = totalFitness(context);
        boolean uniform = total <= 0.0;
        double weighted = 0.0;
        for (int k = 0; k < poolSize; k++) {
            int candidate = candidateAt(context, k);
            if (!context.isAdaptive(candidate)) {
                continue;
            }
            double weight = uniform ? 1.0 : context.population().fitnessAt(candidate);
            weighted += weight * rateFor(context, candidate);
        }
        return weighted / (uniform ? poolSize : total);
    }

    @Override
    public boolean decideAdoption(LearningContext context, IRandomProvider random) {
        OptionalInt teacher = selectTeacher(context, random);
        if (teacher.isEmpty() || !context.isAdaptive(teacher.getAsInt())) {
            return false;
        }
        int teacherIndex = teacher.getAsInt();
        if (teacherIndex == context.focalIndex()) {
            return true;
        }
        return random.nextDouble() < context.rateFrom(teacherIndex);
    }

    private int candidateAt(LearningContext context, int k) {
        return k < context.degree() ? context.neighborAt(k) : context.focalIndex();
    }

    private double rateFor(LearningContext context, int candidate) {
        return candidate == context.focalIndex() ? 1.0 : context.rateFrom(candidate);
    }

    private double totalFitness(LearningContext context) {
        double total = 0.0;
        int degree = context.degree();
        for (int k = 0; k < degree; k++) {
            total += checkedFitness(context, context.neighborAt(k));
        }
        if (includeSelf) {
            total += checkedFitness(context, context.focalIndex());
        }
        return total;
    }

    private static double checkedFitness(LearningContext context, int index) {
        double fitness = context.population().fitnessAt(index);
        if (fitness < 0.0 || Double.isNaN(fitness)) {
            throw new RuntimeInvariantException("Success-biased learning requires non-negative fitness, agent "
                    + context.network().idOf(index) + " has " + fitness);
        }
        return fitness;
    }
}
