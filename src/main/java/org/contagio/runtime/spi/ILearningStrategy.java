package org.contagio.runtime.spi;

import java.util.OptionalInt;

import com.typesafe.config.Config;

/**
 * Service Provider Interface for social-learning rules.
 * <p>
 * A strategy decides, for one focal agent performing the legacy behavior, whether it adopts
 * the adaptive behavior in the current step. It exposes both the exact adoption probability
 * (for analysis and testing) and a single stochastic decision drawn from the trial's random
 * stream. Strategies are stateless after {@link #initialize(Config)} and may be shared by all
 * agents of a model.
 * <p>
 * Implementations must provide a public no-arg constructor; they are configured through
 * HOCON {@code options} blocks.
 */
public interface ILearningStrategy {

    /**
     * Initializes the strategy with its specific configuration object.
     * Called once, immediately after instantiation.
     *
     * @param options The HOCON options for this strategy; an empty Config if none were given.
     */
    void initialize(Config options);

    /**
     * Draws a teacher for the focal agent.
     *
     * @param context The focal agent and population state.
     * @param random The trial's random stream.
     * @return the teacher's agent index, or empty if this strategy does not draw a teacher or
     *         the focal agent has no candidate.
     */
    OptionalInt selectTeacher(LearningContext context, IRandomProvider random);

    /**
     * Computes the exact probability that the focal agent adopts the adaptive behavior in one
     * step, including the adoption-rate gate.
     *
     * @param context The focal agent and population state.
     * @return a probability in [0, 1].
     */
    double adoptionProbability(LearningContext context);

    /**
     * Makes one stochastic adoption decision. The long-run frequency of {@code true} equals
     * {@link #adoptionProbability(LearningContext)}.
     *
     * @param context The focal agent and population state.
     * @param random The trial's random stream.
     * @return {@code true} if the focal agent adopts the adaptive behavior.
     */
    boolean decideAdoption(LearningContext context, IRandomProvider random);
}
