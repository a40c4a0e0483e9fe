package org.contagio.runtime.learning;

import java.util.OptionalInt;

import org.contagio.runtime.spi.ILearningStrategy;
import org.contagio.runtime.spi.IRandomProvider;
import org.contagio.runtime.spi.LearningContext;

import com.typesafe.config.Config;

/**
 * Simple contagion: the learner meets one uniformly drawn neighbor and, if that neighbor
 * performs the adaptive behavior, adopts it with the adoption rate α (or the dyadic override).
 * <pre>
 *   P(adopt) = sum_{j in m} r(i,j) / |n|        (= α |m| / |n| without overrides)
 * </pre>
 * Reversion is governed by the model's drop rate, not by this strategy.
 */
public class ContagionLearning implements ILearningStrategy {

    @Override
    public void initialize(Config options) {
        // No options
    }

    @Override
    public OptionalInt selectTeacher(LearningContext context, IRandomProvider random) {
        int degree = context.degree();
        if (degree == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(context.neighborAt(random.nextInt(degree)));
    }

    @Override
    public double adoptionProbability(LearningContext context) {
        int degree = context.degree();
        if (degree == 0) {
            return 0.0;
        }
        double exposure = 0.0;
        for (int k = 0; k < degree; k++) {
            int neighbor = context.neighborAt(k);
            if (context.isAdaptive(neighbor)) {
                exposure += context.rateFrom(neighbor);
            }
        }
        return exposure / degree;
    }

    @Override
    public boolean decideAdoption(LearningContext context, IRandomProvider random) {
        OptionalInt teacher = selectTeacher(context, random);
        if (teacher.isEmpty() || !context.isAdaptive(teacher.getAsInt())) {
            return false;
        }
        return random.nextDouble() < context.rateFrom(teacher.getAsInt());
    }
}
