package org.contagio.experiment.checkpoint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.contagio.experiment.ExperimentRecord;

/**
 * Checkpoint store that keeps records in memory for the lifetime of the instance.
 * <p>
 * Used when a sweep needs no persistence, and in tests to stand in for an interrupted run.
 */
public class InMemoryCheckpointStore implements ICheckpointStore {

    private final List<ExperimentRecord> records = new ArrayList<>();
    private final Set<ExperimentRecord.Key> keys = new HashSet<>();
    private int appendCalls;

    public InMemoryCheckpointStore() {
    }

    /**
     * @param initial records already present, e.g. from an interrupted sweep.
     */
    public InMemoryCheckpointStore(List<ExperimentRecord> initial) {
        append(initial);
        appendCalls = 0;
    }

    @Override
    public List<ExperimentRecord> load() {
        return List.copyOf(records);
    }

    @Override
    public void append(List<ExperimentRecord> batch) {
        appendCalls++;
        for (ExperimentRecord record : batch) {
            if (keys.add(record.key())) {
                records.add(record);
            }
        }
    }

    /**
     * @return how many times {@link #append(List)} was called since construction.
     */
    public int getAppendCalls() {
        return appendCalls;
    }

    @Override
    public void close() {
        // Nothing to release
    }
}
