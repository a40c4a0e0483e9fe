package org.contagio.runtime.api;

/**
 * Thrown when the model reaches a state in which a step cannot be computed, for example
 * an isolated agent under a payoff model that requires an interaction partner.
 * <p>
 * Trials report these as a failed outcome instead of skipping the affected agent.
 */
public class RuntimeInvariantException extends RuntimeException {

    public RuntimeInvariantException(String message) {
        super(message);
    }
}
