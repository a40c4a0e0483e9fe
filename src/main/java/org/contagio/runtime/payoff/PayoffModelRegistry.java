package org.contagio.runtime.payoff;

import java.lang.reflect.Constructor;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.UnknownStrategyException;
import org.contagio.runtime.spi.IDyadIndependentPayoff;
import org.contagio.runtime.spi.IDyadicPayoff;
import org.contagio.runtime.spi.IPayoffModel;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Resolves payoff model identifiers ({@code dyad-independent}, {@code correlative},
 * {@code complementary} or a class name) to initialized {@link IPayoffModel} instances.
 */
public final class PayoffModelRegistry {

    public static final String DYAD_INDEPENDENT = "dyad-independent";
    public static final String CORRELATIVE = "correlative";
    public static final String COMPLEMENTARY = "complementary";

    private static final Map<String, Supplier<IPayoffModel>> BUILT_INS = Map.of(
            DYAD_INDEPENDENT, DyadIndependentPayoff::new,
            CORRELATIVE, CorrelativeCoordinationPayoff::new,
            COMPLEMENTARY, ComplementaryCoordinationPayoff::new);

    private PayoffModelRegistry() {
    }

    /**
     * Creates a payoff model from a {@code payoff} block. The {@code type} key selects the
     * model (default {@code dyad-independent}); all other keys are the model's options.
     *
     * @param config the payoff block.
     * @return the initialized payoff model.
     */
    public static IPayoffModel fromConfig(Config config) {
        String type = config.hasPath("type") ? config.getString("type") : DYAD_INDEPENDENT;
        return create(type, config.withoutPath("type"));
    }

    /**
     * Creates and initializes a payoff model.
     *
     * @param identifier a built-in identifier or a class name.
     * @param options the payoff options.
     * @return the initialized payoff model.
     * @throws UnknownStrategyException if the identifier cannot be resolved.
     */
    public static IPayoffModel create(String identifier, Config options) {
        Supplier<IPayoffModel> builtIn = BUILT_INS.get(identifier.trim().toLowerCase(Locale.ROOT));
        IPayoffModel model = builtIn != null ? builtIn.get() : instantiate(identifier.trim());
        try {
            model.initialize(options);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid options for payoff model '" + identifier + "': " + e.getMessage(), e);
        }
        return model;
    }

    private static IPayoffModel instantiate(String className) {
        try {
            Class<?> clazz = Class.forName(className);
            if (!(IDyadIndependentPayoff.class.isAssignableFrom(clazz) || IDyadicPayoff.class.isAssignableFrom(clazz))) {
                throw new UnknownStrategyException("Class " + className
                        + " implements neither IDyadIndependentPayoff nor IDyadicPayoff");
            }
            Constructor<?> constructor = clazz.getConstructor();
            return (IPayoffModel) constructor.newInstance();
        } catch (ClassNotFoundException e) {
            throw new UnknownStrategyException("Unknown payoff model: '" + className
                    + "'. Use one of " + BUILT_INS.keySet() + " or a payoff implementation class", e);
        } catch (ReflectiveOperationException e) {
            throw new UnknownStrategyException("Failed to instantiate payoff model: " + className, e);
        }
    }
}
