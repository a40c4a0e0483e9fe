package org.contagio.config;

import org.contagio.experiment.ModelFactory;
import org.contagio.experiment.ParameterCombination;
import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Model factory that overlays each parameter combination onto a base {@code model} block.
 * <p>
 * Parameter names are HOCON paths relative to the model block, so a grid over
 * {@code network.size} and {@code adoption-rate} varies exactly those two settings. Each
 * combination is validated in full before its model is built.
 */
public class ConfiguredModelFactory implements ModelFactory {

    private final Config baseModel;

    /**
     * @param baseModel the {@code model} block the combinations are applied to.
     */
    public ConfiguredModelFactory(Config baseModel) {
        this.baseModel = baseModel;
    }

    /**
     * @param combination the parameter values.
     * @return the validated model configuration for this combination.
     */
    public ModelConfiguration configurationFor(ParameterCombination combination) {
        Config merged = ConfigFactory.parseMap(combination.asMap(), "parameter combination " + combination.getIndex())
                .withFallback(baseModel)
                .resolve();
        return ModelConfiguration.fromConfig(merged);
    }

    @Override
    public AgentBasedModel create(ParameterCombination combination, IRandomProvider random) {
        return configurationFor(combination).build(random);
    }
}
