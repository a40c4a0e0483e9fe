package org.contagio.experiment.checkpoint;

import java.util.Locale;

/**
 * What a checkpoint store does when it finds an unreadable line while loading.
 */
public enum CorruptCheckpointPolicy {
    /** Throw a {@link CheckpointException}; the file is left untouched. */
    ABORT,
    /** Keep the records before the first corrupt line and truncate the file there. */
    RECOVER,
    /** Discard the whole file and start an empty checkpoint. */
    START_FRESH;

    /**
     * @param name "abort", "recover" or "start-fresh" in any case.
     * @return the parsed policy.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static CorruptCheckpointPolicy parse(String name) {
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
