package org.contagio.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.InteractionMode;
import org.contagio.runtime.ModelParameters;
import org.contagio.runtime.UpdateMode;
import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.InvalidParameterException;
import org.contagio.runtime.learning.LearningStrategyRegistry;
import org.contagio.runtime.model.Network;
import org.contagio.runtime.model.NetworkFactory;
import org.contagio.runtime.payoff.PayoffModelRegistry;
import org.contagio.runtime.spi.AdoptionRates;
import org.contagio.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Parsed and validated model definition from a HOCON {@code model} block.
 * <p>
 * Everything that can be checked without randomness is checked in {@link #fromConfig(Config)}:
 * probability ranges, strategy and payoff identifiers and their options, mode names and the
 * adopter declaration. {@link #build(IRandomProvider)} then creates a fresh model per call,
 * drawing the network (for random generators) and any random initial adopters from the given
 * stream.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * model {
 *   network { type = "explicit", edges = [[1, 2], [1, 3], [1, 4], [3, 2]] }
 *   learning { strategy = "success-biased", options { include-self = true } }
 *   adoption-rate = 1.0
 *   drop-rate = 0.0
 *   dyadic-adoption-rates = [ { focal = 1, teacher = 2, rate = 0.5 } ]
 *   payoff { type = "dyad-independent", legacy = 1.0, adaptive = 1.2 }
 *   initial-adopters = [2, 3]        # or: initial-adopter-count = 2
 *   update-mode = "synchronous"      # synchronous | sequential
 *   interaction-mode = "one-random-partner"   # one-random-partner | all-neighbors
 * }
 * }</pre>
 */
public final class ModelConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(ModelConfiguration.class);

    private final Config network;
    private final String strategy;
    private final Config strategyOptions;
    private final Config payoff;
    private final double adoptionRate;
    private final double dropRate;
    private final Map<AdoptionRates.Dyad, Double> dyadicRates;
    private final List<Integer> initialAdopters;
    private final int initialAdopterCount;
    private final UpdateMode updateMode;
    private final InteractionMode interactionMode;

    private ModelConfiguration(Config config) {
        this.network = config.getConfig("network");
        Config learning = config.hasPath("learning") ? config.getConfig("learning") : ConfigFactory.empty();
        this.strategy = learning.hasPath("strategy") ? learning.getString("strategy")
                : LearningStrategyRegistry.SUCCESS_BIASED;
        this.strategyOptions = learning.hasPath("options") ? learning.getConfig("options") : ConfigFactory.empty();
        this.payoff = config.hasPath("payoff") ? config.getConfig("payoff") : ConfigFactory.empty();
        this.adoptionRate = InvalidParameterException.requireProbability("adoption-rate",
                config.hasPath("adoption-rate") ? config.getDouble("adoption-rate") : 1.0);
        this.dropRate = InvalidParameterException.requireProbability("drop-rate",
                config.hasPath("drop-rate") ? config.getDouble("drop-rate") : 0.0);
        this.dyadicRates = parseDyadicRates(config);
        this.updateMode = config.hasPath("update-mode")
                ? UpdateMode.parse(config.getString("update-mode")) : UpdateMode.SYNCHRONOUS;
        this.interactionMode = config.hasPath("interaction-mode")
                ? InteractionMode.parse(config.getString("interaction-mode")) : InteractionMode.ONE_RANDOM_PARTNER;

        boolean hasIds = config.hasPath("initial-adopters");
        boolean hasCount = config.hasPath("initial-adopter-count");
        if (hasIds && hasCount) {
            throw new ConfigurationException("Specify either 'initial-adopters' or 'initial-adopter-count', not both");
        }
        this.initialAdopters = hasIds ? List.copyOf(config.getIntList("initial-adopters")) : List.of();
        this.initialAdopterCount = hasCount ? config.getInt("initial-adopter-count") : -1;
        if (hasCount && initialAdopterCount < 0) {
            throw new ConfigurationException("initial-adopter-count must be >= 0, got " + initialAdopterCount);
        }

        // Resolve once so unknown identifiers and bad options fail here rather than inside a trial
        parameters();
    }

    /**
     * Parses and validates a {@code model} block.
     *
     * @param config the model block.
     * @return the validated configuration.
     * @throws ConfigurationException if any part of the definition is invalid.
     */
    public static ModelConfiguration fromConfig(Config config) {
        try {
            return new ModelConfiguration(config);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid model configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a fresh model in its initial configuration.
     *
     * @param random the random stream of the new model.
     * @return the model.
     */
    public AgentBasedModel build(IRandomProvider random) {
        Network graph = NetworkFactory.fromConfig(network, random);
        List<Integer> adopters = initialAdopterCount >= 0 ? drawAdopters(graph, random) : initialAdopters;
        LOG.debug("Building model on {} agents with {} initial adopters", graph.size(), adopters.size());
        return new AgentBasedModel(graph, parameters(), adopters, random);
    }

    /**
     * Creates the dynamics parameters with fresh strategy and payoff instances.
     *
     * @return the parameters.
     */
    public ModelParameters parameters() {
        ModelParameters.Builder builder = ModelParameters.builder(
                        LearningStrategyRegistry.create(strategy, strategyOptions),
                        PayoffModelRegistry.fromConfig(payoff))
                .adoptionRate(adoptionRate)
                .dropRate(dropRate)
                .updateMode(updateMode)
                .interactionMode(interactionMode);
        for (Map.Entry<AdoptionRates.Dyad, Double> entry : dyadicRates.entrySet()) {
            builder.dyadicAdoptionRate(entry.getKey().focalId(), entry.getKey().teacherId(), entry.getValue());
        }
        return builder.build();
    }

    public String getStrategy() {
        return strategy;
    }

    public double getAdoptionRate() {
        return adoptionRate;
    }

    public double getDropRate() {
        return dropRate;
    }

    public List<Integer> getInitialAdopters() {
        return initialAdopters;
    }

    public UpdateMode getUpdateMode() {
        return updateMode;
    }

    public InteractionMode getInteractionMode() {
        return interactionMode;
    }

    private List<Integer> drawAdopters(Network graph, IRandomProvider random) {
        if (initialAdopterCount > graph.size()) {
            throw new ConfigurationException("initial-adopter-count " + initialAdopterCount
                    + " exceeds the population size " + graph.size());
        }
        int[] order = new int[graph.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.shuffle(order, random.asJavaRandom());
        List<Integer> ids = new ArrayList<>(initialAdopterCount);
        for (int i = 0; i < initialAdopterCount; i++) {
            ids.add(graph.idOf(order[i]));
        }
        return ids;
    }

    private static Map<AdoptionRates.Dyad, Double> parseDyadicRates(Config config) {
        if (!config.hasPath("dyadic-adoption-rates")) {
            return Collections.emptyMap();
        }
        Map<AdoptionRates.Dyad, Double> rates = new LinkedHashMap<>();
        for (Config entry : config.getConfigList("dyadic-adoption-rates")) {
            int focal = entry.getInt("focal");
            int teacher = entry.getInt("teacher");
            double rate = InvalidParameterException.requireProbability(
                    "dyadic adoption rate (" + focal + ", " + teacher + ")", entry.getDouble("rate"));
            rates.put(new AdoptionRates.Dyad(focal, teacher), rate);
        }
        return Collections.unmodifiableMap(rates);
    }
}
