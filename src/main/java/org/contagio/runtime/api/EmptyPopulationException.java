package org.contagio.runtime.api;

/**
 * Thrown when a model is constructed over a network without vertices.
 */
public class EmptyPopulationException extends RuntimeInvariantException {

    public EmptyPopulationException() {
        super("Cannot construct a model with zero agents");
    }
}
