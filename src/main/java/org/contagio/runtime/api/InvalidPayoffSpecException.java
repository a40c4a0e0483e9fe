package org.contagio.runtime.api;

/**
 * Thrown when a payoff table does not cover every behavior combination of the model,
 * contains negative fitness values, or violates the ordering its game requires.
 */
public class InvalidPayoffSpecException extends ConfigurationException {

    public InvalidPayoffSpecException(String message) {
        super(message);
    }
}
