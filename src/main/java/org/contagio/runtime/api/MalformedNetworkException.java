package org.contagio.runtime.api;

/**
 * Thrown when a network definition contains self-loops, duplicate vertex ids,
 * edges to unknown vertices, or generator parameters that cannot produce a graph.
 */
public class MalformedNetworkException extends ConfigurationException {

    public MalformedNetworkException(String message) {
        super(message);
    }
}
