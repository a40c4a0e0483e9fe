package org.contagio.experiment;

import org.contagio.runtime.api.ConfigurationException;

/**
 * Normalizes parameter values to the three types that survive a JSON round trip unchanged:
 * {@link Double}, {@link String} and {@link Boolean}.
 */
final class ParameterValues {

    private ParameterValues() {
    }

    static Object normalize(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        throw new ConfigurationException("Parameter '" + name + "' has unsupported value " + value
                + "; values must be numbers, strings or booleans");
    }
}
