package org.contagio.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.InvalidParameterException;
import org.contagio.runtime.spi.AdoptionRates;
import org.contagio.runtime.spi.IDyadIndependentPayoff;
import org.contagio.runtime.spi.IDyadicPayoff;
import org.contagio.runtime.spi.ILearningStrategy;
import org.contagio.runtime.spi.IPayoffModel;

/**
 * Immutable bundle of everything that governs the dynamics of one model: learning strategy,
 * payoff model, adoption rates, drop rate, update mode and interaction mode.
 * <p>
 * All probabilities are validated when the bundle is built; an out-of-range value never
 * reaches a running model.
 */
public final class ModelParameters {

    private final ILearningStrategy learningStrategy;
    private final IPayoffModel payoffModel;
    private final AdoptionRates adoptionRates;
    private final double dropRate;
    private final UpdateMode updateMode;
    private final InteractionMode interactionMode;

    private ModelParameters(Builder builder) {
        this.learningStrategy = Objects.requireNonNull(builder.learningStrategy, "learningStrategy");
        this.payoffModel = Objects.requireNonNull(builder.payoffModel, "payoffModel");
        if (!(payoffModel instanceof IDyadIndependentPayoff) && !(payoffModel instanceof IDyadicPayoff)) {
            throw new ConfigurationException("Payoff model " + payoffModel.getClass().getName()
                    + " implements neither IDyadIndependentPayoff nor IDyadicPayoff");
        }
        this.adoptionRates = AdoptionRates.uniform(builder.adoptionRate).withOverrides(builder.dyadicRates);
        this.dropRate = InvalidParameterException.requireProbability("drop rate", builder.dropRate);
        this.updateMode = Objects.requireNonNull(builder.updateMode, "updateMode");
        this.interactionMode = Objects.requireNonNull(builder.interactionMode, "interactionMode");
    }

    /**
     * @param learningStrategy the learning strategy.
     * @param payoffModel the payoff model.
     * @return a builder with α = 1, δ = 0, synchronous update and one random partner.
     */
    public static Builder builder(ILearningStrategy learningStrategy, IPayoffModel payoffModel) {
        return new Builder(learningStrategy, payoffModel);
    }

    public ILearningStrategy getLearningStrategy() {
        return learningStrategy;
    }

    public IPayoffModel getPayoffModel() {
        return payoffModel;
    }

    public AdoptionRates getAdoptionRates() {
        return adoptionRates;
    }

    /**
     * @return the global adoption rate α.
     */
    public double getAdoptionRate() {
        return adoptionRates.getBaseRate();
    }

    /**
     * @return the drop rate δ.
     */
    public double getDropRate() {
        return dropRate;
    }

    public UpdateMode getUpdateMode() {
        return updateMode;
    }

    public InteractionMode getInteractionMode() {
        return interactionMode;
    }

    @Override
    public String toString() {
        return "ModelParameters{strategy=" + learningStrategy.getClass().getSimpleName()
                + ", payoff=" + payoffModel.getClass().getSimpleName()
                + ", adoptionRate=" + getAdoptionRate() + ", dropRate=" + dropRate
                + ", dyadicOverrides=" + adoptionRates.hasOverrides()
                + ", updateMode=" + updateMode + ", interactionMode=" + interactionMode + "}";
    }

    /**
     * Builder for {@link ModelParameters}.
     */
    public static final class Builder {

        private final ILearningStrategy learningStrategy;
        private final IPayoffModel payoffModel;
        private double adoptionRate = 1.0;
        private double dropRate = 0.0;
        private final Map<AdoptionRates.Dyad, Double> dyadicRates = new LinkedHashMap<>();
        private UpdateMode updateMode = UpdateMode.SYNCHRONOUS;
        private InteractionMode interactionMode = InteractionMode.ONE_RANDOM_PARTNER;

        private Builder(ILearningStrategy learningStrategy, IPayoffModel payoffModel) {
            this.learningStrategy = learningStrategy;
            this.payoffModel = payoffModel;
        }

        public Builder adoptionRate(double adoptionRate) {
            this.adoptionRate = adoptionRate;
            return this;
        }

        public Builder dropRate(double dropRate) {
            this.dropRate = dropRate;
            return this;
        }

        /**
         * Adds a dyadic override α<sub>ij</sub> for the ordered pair (focal, teacher).
         */
        public Builder dyadicAdoptionRate(int focalId, int teacherId, double rate) {
            dyadicRates.put(new AdoptionRates.Dyad(focalId, teacherId), rate);
            return this;
        }

        public Builder updateMode(UpdateMode updateMode) {
            this.updateMode = updateMode;
            return this;
        }

        public Builder interactionMode(InteractionMode interactionMode) {
            this.interactionMode = interactionMode;
            return this;
        }

        /**
         * @return the validated parameters.
         * @throws InvalidParameterException if a probability lies outside [0, 1].
         */
        public ModelParameters build() {
            return new ModelParameters(this);
        }
    }
}
