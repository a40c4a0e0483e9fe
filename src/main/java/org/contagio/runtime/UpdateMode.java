package org.contagio.runtime;

import java.util.Locale;

import org.contagio.runtime.api.ConfigurationException;

/**
 * How the decisions of one step become visible to the other agents of the same step.
 */
public enum UpdateMode {
    /**
     * Every decision reads the start-of-step snapshot; all changes are committed together.
     */
    SYNCHRONOUS,
    /**
     * Agents decide one at a time in a fresh random order; each change is visible to every later
     * decision of the same step.
     */
    SEQUENTIAL;

    /**
     * @param name "synchronous" or "sequential" in any case.
     * @return the parsed mode.
     * @throws ConfigurationException if the name is unknown.
     */
    public static UpdateMode parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown update mode: '" + name + "'. Valid modes: synchronous, sequential");
        }
    }
}
