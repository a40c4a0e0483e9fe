package org.contagio.runtime.api;

/**
 * Thrown when a model, network, strategy or payoff definition is invalid.
 * <p>
 * Configuration errors are always raised at construction time. Nothing in the runtime silently
 * replaces an invalid value with a default; the only defaults applied are the documented
 * divide-by-zero fallbacks of the learning strategies.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Creates a ConfigurationException with the specified message.
     *
     * @param message Description of the configuration problem
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a ConfigurationException with the specified message and cause.
     *
     * @param message Description of the configuration problem
     * @param cause The underlying exception
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
