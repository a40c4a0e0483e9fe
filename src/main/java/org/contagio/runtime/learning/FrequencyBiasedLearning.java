package org.contagio.runtime.learning;

import java.util.OptionalInt;

import org.contagio.runtime.spi.ILearningStrategy;
import org.contagio.runtime.spi.IRandomProvider;
import org.contagio.runtime.spi.LearningContext;

import com.typesafe.config.Config;

/**
 * Frequency-biased learning: the adoption probability equals the share of the
 * neighborhood performing the adaptive behavior. No teacher is drawn.
 * <pre>
 *   P(adopt) = sum_{j in m} r(i,j) / |n|
 * </pre>
 * An isolated agent never adopts. With {@code include-self} the learner counts as a member of
 * its own neighborhood, matching the success-biased teacher pool.
 */
public class FrequencyBiasedLearning implements ILearningStrategy {

    private boolean includeSelf = false;

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
        return OptionalInt.empty();
    }

    @Override
    public double adoptionProbability(LearningContext context) {
        int degree = context.degree();
        int poolSize = degree + (includeSelf ? 1 : 0);
        if (poolSize == 0) {
            return 0.0;
        }
        double adopters = 0.0;
        for (int k = 0; k < degree; k++) {
            int neighbor = context.neighborAt(k);
            if (context.isAdaptive(neighbor)) {
                adopters += context.rateFrom(neighbor);
            }
        }
        if (includeSelf && context.isAdaptive(context.focalIndex())) {
            adopters += 1.0;
        }
        return adopters / poolSize;
    }

    @Override
    public boolean decideAdoption(LearningContext context, IRandomProvider random) {
        double probability = adoptionProbability(context);
        return probability > 0.0 && random.nextDouble() < probability;
    }
}
