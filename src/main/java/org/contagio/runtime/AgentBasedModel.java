package org.contagio.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.EmptyPopulationException;
import org.contagio.runtime.api.RuntimeInvariantException;
import org.contagio.runtime.model.Agent;
import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.model.Network;
import org.contagio.runtime.spi.IDyadIndependentPayoff;
import org.contagio.runtime.spi.IDyadicPayoff;
import org.contagio.runtime.spi.ILearningStrategy;
import org.contagio.runtime.spi.IModelMeasure;
import org.contagio.runtime.spi.IRandomProvider;
import org.contagio.runtime.spi.IStepObserver;
import org.contagio.runtime.spi.LearningContext;
import org.contagio.runtime.spi.PopulationView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * The agent-based model: a population of agents on a network, advanced one step at a time.
 * <p>
 * The model owns its agents in a dense arena indexed like the network's vertices. A step runs
 * three phases:
 * <ol>
 *   <li>Fitness: every agent's fitness is recomputed from the start-of-step behaviors. A
 *       dyad-dependent payoff is evaluated against one uniformly drawn neighbor or, under
 *       {@link InteractionMode#ALL_NEIGHBORS}, averaged over all neighbors.</li>
 *   <li>Adoption: every agent performing the legacy behavior at the start of the step takes
 *       one adoption decision through the learning strategy.</li>
 *   <li>Drop: every agent performing the adaptive behavior at the start of the step reverts
 *       with the drop rate δ.</li>
 * </ol>
 * Under {@link UpdateMode#SYNCHRONOUS} all decisions read the start-of-step snapshot and are
 * committed together. Under {@link UpdateMode#SEQUENTIAL} agents are visited in a fresh random
 * permutation and every change is visible to later decisions of the same step.
 * <p>
 * A model is confined to one thread. All randomness comes from the {@link IRandomProvider}
 * given at construction.
 */
public class AgentBasedModel {
    private static final Logger LOG = LoggerFactory.getLogger(AgentBasedModel.class);

    private final Network network;
    private final ModelParameters parameters;
    private final IRandomProvider random;
    private final Agent[] agents;
    private final Behavior[] snapshot;
    private final PopulationView snapshotView = new SnapshotView();
    private final PopulationView liveView = new LiveView();
    private final List<IStepObserver> stepObservers = new ArrayList<>();
    private final Map<String, IModelMeasure> measures = new LinkedHashMap<>();
    private long currentStep = 0L;

    /**
     * Creates a model in its initial configuration and computes the initial fitness.
     *
     * @param network The network the population lives on; one agent per vertex.
     * @param parameters The dynamics parameters.
     * @param initialAdopterIds Ids of the agents that start with the adaptive behavior.
     * @param random The random stream of this model.
     * @throws EmptyPopulationException if the network has no vertices.
     * @throws ConfigurationException if an initial adopter id is not a vertex of the network.
     * @throws RuntimeInvariantException if a dyad-dependent payoff meets an isolated agent.
     */
    public AgentBasedModel(Network network, ModelParameters parameters, Collection<Integer> initialAdopterIds,
                           IRandomProvider random) {
        if (network.size() == 0) {
            throw new EmptyPopulationException();
        }
        this.network = network;
        this.parameters = parameters;
        this.random = random;
        this.agents = new Agent[network.size()];
        this.snapshot = new Behavior[network.size()];
        for (int i = 0; i < agents.length; i++) {
            agents[i] = new Agent(network.idOf(i), i, Behavior.LEGACY);
        }
        for (int id : initialAdopterIds) {
            int index = network.indexOf(id);
            if (index < 0) {
                throw new ConfigurationException("Initial adopter " + id + " is not a vertex of the network");
            }
            agents[index].setBehavior(Behavior.ADAPTIVE);
        }
        recomputeFitness();
    }

    /**
     * Adds a step observer. Observers run in registration order after every step.
     * @param observer The observer to add.
     */
    public void addStepObserver(IStepObserver observer) {
        stepObservers.add(observer);
    }

    /**
     * Registers a named measure evaluated after every step and stored in the {@link StepSummary}.
     * @param name The measure name.
     * @param measure The measure.
     */
    public void addMeasure(String name, IModelMeasure measure) {
        measures.put(name, measure);
    }

    public Map<String, IModelMeasure> getMeasures() {
        return Collections.unmodifiableMap(measures);
    }

    public Network getNetwork() {
        return network;
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public IRandomProvider getRandomProvider() {
        return random;
    }

    /**
     * @return the number of completed steps.
     */
    public long getStep() {
        return currentStep;
    }

    public int size() {
        return agents.length;
    }

    public Agent agentAt(int index) {
        return agents[index];
    }

    /**
     * @param id An agent id.
     * @return the agent with this id, or empty if no such agent exists.
     */
    public Optional<Agent> agentById(int id) {
        int index = network.indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(agents[index]);
    }

    public int count(Behavior behavior) {
        int count = 0;
        for (Agent agent : agents) {
            if (agent.getBehavior() == behavior) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return the behavior shared by every agent, or empty while both behaviors coexist.
     */
    public Optional<Behavior> fixatedBehavior() {
        Behavior first = agents[0].getBehavior();
        for (Agent agent : agents) {
            if (agent.getBehavior() != first) {
                return Optional.empty();
            }
        }
        return Optional.of(first);
    }

    /**
     * Computes the exact probability that the given agent adopts the adaptive behavior in the
     * next step, from the current behaviors and fitness values.
     *
     * @param id An agent id.
     * @return the adoption probability.
     * @throws IllegalArgumentException if no agent has this id.
     */
    public double adoptionProbability(int id) {
        int index = network.indexOf(id);
        if (index < 0) {
            throw new IllegalArgumentException("No agent with id " + id);
        }
        return parameters.getLearningStrategy().adoptionProbability(contextFor(index, liveView));
    }

    /**
     * @return the summary of the current state, without advancing the model.
     */
    public StepSummary summarize() {
        int adaptive = count(Behavior.ADAPTIVE);
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, IModelMeasure> entry : measures.entrySet()) {
            values.put(entry.getKey(), entry.getValue().measure(this));
        }
        return new StepSummary(currentStep, agents.length - adaptive, adaptive, values);
    }

    /**
     * Advances the model by one step.
     * <p>
     * Decisions read the fitness derived from the start-of-step behaviors. After the new
     * behaviors are committed the fitness is derived again, so measures, observers and
     * {@link #adoptionProbability(int)} always see values that match the current behaviors.
     * Under {@link InteractionMode#ONE_RANDOM_PARTNER} that refresh draws the partners used by the
     * next step.
     *
     * @return the summary after the step.
     * @throws RuntimeInvariantException if a dyad-dependent payoff meets an isolated agent, or a
     *         strategy or payoff detects an invalid state.
     */
    public StepSummary advanceOneStep() {
        for (int i = 0; i < agents.length; i++) {
            snapshot[i] = agents[i].getBehavior();
        }
        if (parameters.getUpdateMode() == UpdateMode.SEQUENTIAL) {
            stepSequential();
        } else {
            stepSynchronous();
        }
        recomputeFitness();
        currentStep++;

        StepSummary summary = summarize();
        for (IStepObserver observer : stepObservers) {
            try {
                observer.onStep(this, summary);
            } catch (Exception e) {
                LOG.warn("Step observer '{}' failed at step {}: {}",
                        observer.getClass().getSimpleName(), currentStep, e.getMessage());
            }
        }
        return summary;
    }

    /**
     * Decides every agent against the start-of-step snapshot, then commits all changes at once.
     */
    private void stepSynchronous() {
        Behavior[] next = new Behavior[agents.length];
        for (int i = 0; i < agents.length; i++) {
            next[i] = decide(i, snapshotView);
        }
        for (int i = 0; i < agents.length; i++) {
            agents[i].setBehavior(next[i]);
        }
    }

    /**
     * Decides agents one at a time in a fresh random order; each change is applied immediately.
     */
    private void stepSequential() {
        int[] order = new int[agents.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.shuffle(order, random.asJavaRandom());
        for (int index : order) {
            agents[index].setBehavior(decide(index, liveView));
        }
    }

    /**
     * Applies the adoption or drop rule to one agent, depending on its start-of-step behavior.
     */
    private Behavior decide(int index, PopulationView view) {
        if (snapshot[index] == Behavior.LEGACY) {
            ILearningStrategy strategy = parameters.getLearningStrategy();
            return strategy.decideAdoption(contextFor(index, view), random) ? Behavior.ADAPTIVE : Behavior.LEGACY;
        }
        double dropRate = parameters.getDropRate();
        if (dropRate > 0.0 && random.nextDouble() < dropRate) {
            return Behavior.LEGACY;
        }
        return Behavior.ADAPTIVE;
    }

    private LearningContext contextFor(int index, PopulationView view) {
        return new LearningContext(index, view, parameters.getAdoptionRates());
    }

    private void recomputeFitness() {
        if (parameters.getPayoffModel() instanceof IDyadIndependentPayoff payoff) {
            for (Agent agent : agents) {
                agent.setFitness(payoff.payoff(agent.getBehavior()));
            }
            return;
        }
        IDyadicPayoff payoff = (IDyadicPayoff) parameters.getPayoffModel();
        boolean allNeighbors = parameters.getInteractionMode() == InteractionMode.ALL_NEIGHBORS;
        // Partners contribute their behavior only, never their fitness
        for (int i = 0; i < agents.length; i++) {
            int degree = network.degree(i);
            if (degree == 0) {
                throw new RuntimeInvariantException("Agent " + agents[i].getId()
                        + " has no neighbors but the dyad-dependent payoff requires an interaction partner");
            }
            Behavior own = agents[i].getBehavior();
            double fitness;
            if (allNeighbors) {
                double sum = 0.0;
                for (int k = 0; k < degree; k++) {
                    sum += payoff.payoff(own, agents[network.neighborAt(i, k)].getBehavior());
                }
                fitness = sum / degree;
            } else {
                int partner = network.neighborAt(i, random.nextInt(degree));
                fitness = payoff.payoff(own, agents[partner].getBehavior());
            }
            agents[i].setFitness(fitness);
        }
    }

    @Override
    public String toString() {
        return "AgentBasedModel{agents=" + agents.length + ", step=" + currentStep
                + ", adaptive=" + count(Behavior.ADAPTIVE) + ", parameters=" + parameters + "}";
    }

    /**
     * Reads behaviors from the start-of-step snapshot.
     */
    private final class SnapshotView implements PopulationView {
        @Override
        public Network network() {
            return network;
        }

        @Override
        public Behavior behaviorAt(int index) {
            return snapshot[index];
        }

        @Override
        public double fitnessAt(int index) {
            return agents[index].getFitness();
        }
    }

    /**
     * Reads the current agent behaviors.
     */
    private final class LiveView implements PopulationView {
        @Override
        public Network network() {
            return network;
        }

        @Override
        public Behavior behaviorAt(int index) {
            return agents[index].getBehavior();
        }

        @Override
        public double fitnessAt(int index) {
            return agents[index].getFitness();
        }
    }
}
