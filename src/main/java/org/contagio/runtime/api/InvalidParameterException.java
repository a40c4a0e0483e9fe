package org.contagio.runtime.api;

/**
 * Thrown when a probability or other bounded scalar lies outside its permitted range.
 */
public class InvalidParameterException extends ConfigurationException {

    public InvalidParameterException(String message) {
        super(message);
    }

    /**
     * Validates that {@code value} is a probability.
     *
     * @param name The parameter name used in the error message.
     * @param value The value to check.
     * @return the value, unchanged.
     * @throws InvalidParameterException if the value is NaN or outside [0, 1].
     */
    public static double requireProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidParameterException(name + " must be within [0, 1], got " + value);
        }
        return value;
    }
}
