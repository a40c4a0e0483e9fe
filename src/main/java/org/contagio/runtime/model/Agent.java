package org.contagio.runtime.model;

/**
 * Mutable per-individual state of one agent.
 * <p>
 * Agents live in the arena of the {@code AgentBasedModel} that created them and are never shared
 * between models. Neighbors are not held as references; they are resolved through the model's
 * {@link Network} by {@link #getIndex()}.
 * <p>
 * The fitness value is a cache written by the model during payoff recomputation. It is always
 * re-derivable from the current behavior, the payoff model and the interaction partners drawn
 * in the same step.
 */
public class Agent {

    private final int id;
    private final int index;
    private Behavior behavior;
    private double fitness;

    /**
     * Creates an agent.
     *
     * @param id The external, stable id (the network vertex id).
     * @param index The dense arena slot of this agent within its model.
     * @param behavior The initial behavior.
     */
    public Agent(int id, int index, Behavior behavior) {
        this.id = id;
        this.index = index;
        this.behavior = behavior;
    }

    public int getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public void setBehavior(Behavior behavior) {
        this.behavior = behavior;
    }

    public double getFitness() {
        return fitness;
    }

    public void setFitness(double fitness) {
        this.fitness = fitness;
    }

    public boolean isAdaptive() {
        return behavior == Behavior.ADAPTIVE;
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", behavior=" + behavior + ", fitness=" + fitness + "}";
    }
}
