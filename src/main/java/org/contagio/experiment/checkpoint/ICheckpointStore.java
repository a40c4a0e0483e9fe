package org.contagio.experiment.checkpoint;

import java.util.List;

import org.contagio.experiment.ExperimentRecord;

/**
 * Persistent set of experiment records keyed by (combination key, replicate).
 * <p>
 * A store is an explicitly scoped resource: the experiment runner loads it once at the start
 * of a sweep and appends to it after every batch, always from the same thread. Appends are
 * idempotent: a record whose key is already stored is skipped.
 */
public interface ICheckpointStore extends AutoCloseable {

    /**
     * Loads every stored record.
     *
     * @return the records in the order they were written, without duplicate keys.
     * @throws CheckpointException if the store cannot be read and the corrupt-data policy does not recover.
     */
    List<ExperimentRecord> load();

    /**
     * Appends records and makes them durable before returning.
     *
     * @param records the records to append.
     * @throws CheckpointException if the records cannot be written.
     */
    void append(List<ExperimentRecord> records);

    @Override
    void close();
}
