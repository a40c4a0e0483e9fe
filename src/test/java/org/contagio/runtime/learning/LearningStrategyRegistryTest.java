package org.contagio.runtime.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.UnknownStrategyException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LearningStrategyRegistryTest {

    @Test
    void resolvesBuiltInsCaseInsensitively() {
        assertThat(LearningStrategyRegistry.create("Success-Biased")).isInstanceOf(SuccessBiasedLearning.class);
        assertThat(LearningStrategyRegistry.create(" frequency-biased ")).isInstanceOf(FrequencyBiasedLearning.class);
        assertThat(LearningStrategyRegistry.create("CONTAGION")).isInstanceOf(ContagionLearning.class);
        assertThat(LearningStrategyRegistry.builtInIdentifiers())
                .containsExactlyInAnyOrder("success-biased", "frequency-biased", "contagion");
    }

    @Test
    void passesOptionsToTheStrategy() {
        SuccessBiasedLearning strategy = (SuccessBiasedLearning) LearningStrategyRegistry.create(
                "success-biased", ConfigFactory.parseString("include-self = false"));

        assertThat(strategy.isIncludeSelf()).isFalse();
    }

    @Test
    void resolvesClassNames() {
        assertThat(LearningStrategyRegistry.create(FrequencyBiasedLearning.class.getName()))
                .isInstanceOf(FrequencyBiasedLearning.class);
    }

    @Test
    void rejectsUnknownIdentifiers() {
        assertThatThrownBy(() -> LearningStrategyRegistry.create("imitate-the-best"))
                .isInstanceOf(UnknownStrategyException.class)
                .hasMessageContaining("imitate-the-best");
        assertThatThrownBy(() -> LearningStrategyRegistry.create("java.lang.String"))
                .isInstanceOf(UnknownStrategyException.class)
                .hasMessageContaining("does not implement");
        assertThatThrownBy(() -> LearningStrategyRegistry.create(" "))
                .isInstanceOf(UnknownStrategyException.class);
    }

    @Test
    void wrapsInvalidOptions() {
        assertThatThrownBy(() -> LearningStrategyRegistry.create("success-biased",
                ConfigFactory.parseString("include-self = sometimes")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("success-biased");
    }
}
