package org.contagio.experiment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.contagio.experiment.checkpoint.ICheckpointStore;
import org.contagio.experiment.checkpoint.InMemoryCheckpointStore;
import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.StoppingPredicate;
import org.contagio.runtime.Trial;
import org.contagio.runtime.TrialOutcome;
import org.contagio.runtime.TrialResult;
import org.contagio.runtime.internal.services.SeededRandomProvider;
import org.contagio.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one independent {@link Trial} per (combination, replicate) of a {@link ParameterGrid}.
 * <p>
 * Every trial draws from its own stream, derived from the global seed, the combination index
 * and the replicate index only, so results do not depend on the parallelism or on the order
 * in which trials happen to finish. Combinations are processed in batches of
 * {@code checkpointInterval}; after each batch the coordinating thread appends the batch's
 * records to the checkpoint store. Records already present in the store when the sweep starts
 * are not recomputed.
 * <p>
 * A trial that fails, or whose model cannot be built, becomes a record with outcome
 * {@link TrialOutcome#FAILED}; the sweep continues.
 */
public class ExperimentRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ExperimentRunner.class);

    private final ModelFactory modelFactory;
    private final ParameterGrid grid;
    private final int replicates;
    private final long maxSteps;
    private final StoppingPredicate stoppingPredicate;
    private final long seed;
    private final int parallelism;
    private final ICheckpointStore checkpointStore;
    private final int checkpointInterval;

    private ExperimentRunner(Builder builder) {
        this.modelFactory = Objects.requireNonNull(builder.modelFactory, "modelFactory");
        this.grid = Objects.requireNonNull(builder.grid, "grid");
        this.replicates = builder.replicates;
        this.maxSteps = builder.maxSteps;
        this.stoppingPredicate = builder.stoppingPredicate;
        this.seed = builder.seed;
        this.parallelism = resolveParallelism(builder.parallelism);
        this.checkpointStore = builder.checkpointStore != null ? builder.checkpointStore : new InMemoryCheckpointStore();
        this.checkpointInterval = builder.checkpointInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs the sweep. The checkpoint store is used but not closed; its owner closes it.
     *
     * @return one record per (combination, replicate), ordered by combination index and replicate.
     * @throws org.contagio.experiment.checkpoint.CheckpointException if the checkpoint cannot be read or written.
     */
    public List<ExperimentRecord> run() {
        List<ParameterCombination> combinations = grid.combinations();
        Map<String, Integer> indexByKey = new HashMap<>();
        for (ParameterCombination combination : combinations) {
            indexByKey.put(combination.key(), combination.getIndex());
        }

        Map<ExperimentRecord.Key, ExperimentRecord> completed = new LinkedHashMap<>();
        int ignored = 0;
        for (ExperimentRecord record : checkpointStore.load()) {
            Integer index = indexByKey.get(record.combinationKey());
            if (index == null || record.replicate() < 0 || record.replicate() >= replicates) {
                ignored++;
                continue;
            }
            completed.put(record.key(), record.withCombinationIndex(index));
        }
        if (ignored > 0) {
            LOG.info("Ignoring {} checkpointed records outside the current grid", ignored);
        }

        List<List<TrialTask>> batches = planBatches(combinations, completed);
        int pendingTrials = batches.stream().mapToInt(List::size).sum();
        LOG.info("Starting sweep: {} combinations x {} replicates, {} already completed, {} to run on {} thread(s)",
                combinations.size(), replicates, completed.size(), pendingTrials, parallelism);

        TrialWorkerPool pool = (parallelism > 1 && pendingTrials > 1) ? new TrialWorkerPool(parallelism) : null;
        try {
            int finished = 0;
            for (int b = 0; b < batches.size(); b++) {
                List<TrialTask> batch = batches.get(b);
                ExperimentRecord[] results = new ExperimentRecord[batch.size()];
                if (pool != null) {
                    pool.dispatch(batch.size(), i -> results[i] = runTrial(batch.get(i)));
                } else {
                    for (int i = 0; i < batch.size(); i++) {
                        results[i] = runTrial(batch.get(i));
                    }
                }
                List<ExperimentRecord> batchRecords = List.of(results);
                checkpointStore.append(batchRecords);
                for (ExperimentRecord record : batchRecords) {
                    completed.put(record.key(), record);
                }
                finished += batch.size();
                LOG.info("Batch {}/{} complete: {}/{} pending trials done", b + 1, batches.size(), finished, pendingTrials);
            }
        } finally {
            if (pool != null) {
                pool.close();
            }
        }

        List<ExperimentRecord> records = new ArrayList<>(completed.values());
        records.sort(Comparator.comparingInt(ExperimentRecord::combinationIndex)
                .thenComparingInt(ExperimentRecord::replicate));
        LOG.info("Sweep finished: {} records", records.size());
        return records;
    }

    private List<List<TrialTask>> planBatches(List<ParameterCombination> combinations,
                                              Map<ExperimentRecord.Key, ExperimentRecord> completed) {
        List<List<TrialTask>> batches = new ArrayList<>();
        List<TrialTask> current = new ArrayList<>();
        int combinationsInBatch = 0;
        for (ParameterCombination combination : combinations) {
            List<TrialTask> tasks = new ArrayList<>();
            for (int r = 0; r < replicates; r++) {
                if (!completed.containsKey(new ExperimentRecord.Key(combination.key(), r))) {
                    tasks.add(new TrialTask(combination, r));
                }
            }
            if (tasks.isEmpty()) {
                continue;
            }
            current.addAll(tasks);
            if (++combinationsInBatch == checkpointInterval) {
                batches.add(current);
                current = new ArrayList<>();
                combinationsInBatch = 0;
            }
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }

    /**
     * Runs one trial. Called concurrently from worker threads; touches no shared mutable state.
     */
    private ExperimentRecord runTrial(TrialTask task) {
        ParameterCombination combination = task.combination();
        IRandomProvider random = new SeededRandomProvider(seed)
                .deriveFor("combination", combination.getIndex())
                .deriveFor("replicate", task.replicate());
        AgentBasedModel model;
        try {
            model = modelFactory.create(combination, random);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.warn("Model construction failed for combination {} replicate {}: {}",
                    combination.key(), task.replicate(), message);
            return new ExperimentRecord(combination.getIndex(), combination.key(), combination.asMap(),
                    task.replicate(), TrialOutcome.FAILED, 0L, Double.NaN, message);
        }

        TrialResult result = new Trial(model, maxSteps, stoppingPredicate).run();
        if (result.outcome() == TrialOutcome.FAILED) {
            LOG.warn("Trial failed for combination {} replicate {} at step {}: {}",
                    combination.key(), task.replicate(), result.terminalStep(), result.failureMessage());
        } else {
            LOG.debug("Combination {} replicate {}: {} at step {}",
                    combination.key(), task.replicate(), result.outcome(), result.terminalStep());
        }
        return new ExperimentRecord(combination.getIndex(), combination.key(), combination.asMap(),
                task.replicate(), result.outcome(), result.terminalStep(), result.finalAdaptiveFraction(),
                result.failureMessage());
    }

    /**
     * @param parallelism 0 = auto ({@code max(1, availableProcessors - 1)}), otherwise the exact thread count.
     */
    private static int resolveParallelism(int parallelism) {
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must be >= 0, got " + parallelism);
        }
        if (parallelism == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return parallelism;
    }

    private record TrialTask(ParameterCombination combination, int replicate) {}

    /**
     * Builder for {@link ExperimentRunner}.
     */
    public static final class Builder {

        private ModelFactory modelFactory;
        private ParameterGrid grid;
        private int replicates = 1;
        private long maxSteps = 1000;
        private StoppingPredicate stoppingPredicate = StoppingPredicate.never();
        private long seed = 0L;
        private int parallelism = 1;
        private ICheckpointStore checkpointStore;
        private int checkpointInterval = 1;

        private Builder() {
        }

        public Builder modelFactory(ModelFactory modelFactory) {
            this.modelFactory = modelFactory;
            return this;
        }

        public Builder grid(ParameterGrid grid) {
            this.grid = grid;
            return this;
        }

        public Builder replicates(int replicates) {
            if (replicates < 1) {
                throw new IllegalArgumentException("replicates must be >= 1, got " + replicates);
            }
            this.replicates = replicates;
            return this;
        }

        public Builder maxSteps(long maxSteps) {
            if (maxSteps < 0) {
                throw new IllegalArgumentException("maxSteps must be >= 0, got " + maxSteps);
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder stoppingPredicate(StoppingPredicate stoppingPredicate) {
            this.stoppingPredicate = Objects.requireNonNull(stoppingPredicate);
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @param parallelism 0 = auto, 1 = run on the calling thread only, N &gt; 1 = exactly N threads.
         */
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointStore(ICheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        /**
         * @param checkpointInterval number of combinations per batch (and per checkpoint write).
         */
        public Builder checkpointInterval(int checkpointInterval) {
            if (checkpointInterval < 1) {
                throw new IllegalArgumentException("checkpointInterval must be >= 1, got " + checkpointInterval);
            }
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public ExperimentRunner build() {
            return new ExperimentRunner(this);
        }
    }
}
