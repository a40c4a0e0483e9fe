package org.contagio.runtime.learning;

import java.lang.reflect.Constructor;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.UnknownStrategyException;
import org.contagio.runtime.spi.ILearningStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Resolves learning strategy identifiers to initialized {@link ILearningStrategy} instances.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>Built-in identifier ({@code success-biased}, {@code frequency-biased}, {@code contagion}),
 *       matched case-insensitively.</li>
 *   <li>Fully-qualified name of a class implementing {@link ILearningStrategy} with a public
 *       no-arg constructor.</li>
 * </ol>
 */
public final class LearningStrategyRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LearningStrategyRegistry.class);

    public static final String SUCCESS_BIASED = "success-biased";
    public static final String FREQUENCY_BIASED = "frequency-biased";
    public static final String CONTAGION = "contagion";

    private static final Map<String, Supplier<ILearningStrategy>> BUILT_INS = Map.of(
            SUCCESS_BIASED, SuccessBiasedLearning::new,
            FREQUENCY_BIASED, FrequencyBiasedLearning::new,
            CONTAGION, ContagionLearning::new);

    private LearningStrategyRegistry() {
    }

    /**
     * @return the built-in strategy identifiers.
     */
    public static Set<String> builtInIdentifiers() {
        return BUILT_INS.keySet();
    }

    /**
     * Creates a strategy with default options.
     *
     * @param identifier a built-in identifier or a class name.
     * @return the initialized strategy.
     * @throws UnknownStrategyException if the identifier cannot be resolved.
     */
    public static ILearningStrategy create(String identifier) {
        return create(identifier, ConfigFactory.empty());
    }

    /**
     * Creates and initializes a strategy.
     *
     * @param identifier a built-in identifier or a class name.
     * @param options the strategy options.
     * @return the initialized strategy.
     * @throws UnknownStrategyException if the identifier cannot be resolved.
     * @throws ConfigurationException if the options are invalid.
     */
    public static ILearningStrategy create(String identifier, Config options) {
        if (identifier == null || identifier.isBlank()) {
            throw new UnknownStrategyException("Learning strategy identifier must not be empty");
        }
        Supplier<ILearningStrategy> builtIn = BUILT_INS.get(identifier.trim().toLowerCase(Locale.ROOT));
        ILearningStrategy strategy = builtIn != null ? builtIn.get() : instantiate(identifier.trim());
        try {
            strategy.initialize(options);
        } catch (com.typesafe.config.ConfigException e) {
            throw new ConfigurationException("Invalid options for learning strategy '" + identifier + "': " + e.getMessage(), e);
        }
        LOG.debug("Created learning strategy {} for identifier '{}'", strategy.getClass().getSimpleName(), identifier);
        return strategy;
    }

    private static ILearningStrategy instantiate(String className) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new UnknownStrategyException("Unknown learning strategy: '" + className
                    + "'. Use one of " + BUILT_INS.keySet() + " or a class implementing ILearningStrategy", e);
        }
        if (!ILearningStrategy.class.isAssignableFrom(clazz)) {
            throw new UnknownStrategyException("Class " + className + " does not implement ILearningStrategy");
        }
        try {
            Constructor<?> constructor = clazz.getConstructor();
            return (ILearningStrategy) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new UnknownStrategyException("Failed to instantiate learning strategy: " + className, e);
        }
    }
}
