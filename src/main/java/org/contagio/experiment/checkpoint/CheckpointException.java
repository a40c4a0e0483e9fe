package org.contagio.experiment.checkpoint;

/**
 * Thrown when a checkpoint cannot be read, parsed or written.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
