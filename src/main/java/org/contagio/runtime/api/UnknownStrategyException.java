package org.contagio.runtime.api;

/**
 * Thrown when a learning strategy or payoff model identifier is neither a registered
 * built-in nor a loadable implementation class.
 */
public class UnknownStrategyException extends ConfigurationException {

    public UnknownStrategyException(String message) {
        super(message);
    }

    public UnknownStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
