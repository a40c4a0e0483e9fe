package org.contagio.experiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.contagio.config.ConfiguredModelFactory;
import org.contagio.experiment.checkpoint.InMemoryCheckpointStore;
import org.contagio.junit.extensions.logging.ExpectLog;
import org.contagio.junit.extensions.logging.LogLevel;
import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.ModelParameters;
import org.contagio.runtime.TrialOutcome;
import org.contagio.runtime.api.RuntimeInvariantException;
import org.contagio.runtime.learning.ContagionLearning;
import org.contagio.runtime.model.NetworkFactory;
import org.contagio.runtime.payoff.DyadIndependentPayoff;
import org.contagio.runtime.spi.ILearningStrategy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ExperimentRunnerTest {

    private static final ModelFactory FACTORY = new ConfiguredModelFactory(ConfigFactory.parseString("""
            network { type = complete, size = 12 }
            payoff { legacy = 1.0, adaptive = 1.0 }
            initial-adopter-count = 3
            """));

    private static final ParameterGrid GRID = ParameterGrid.builder()
            .add("adoption-rate", 0.3, 1.0)
            .add("payoff.adaptive", 1.0, 2.0)
            .build();

    @Test
    void producesOneRecordPerCombinationAndReplicateInOrder() {
        List<ExperimentRecord> records = runner(1, new InMemoryCheckpointStore()).run();

        assertThat(records).hasSize(12);
        for (int i = 0; i < records.size(); i++) {
            assertThat(records.get(i).combinationIndex()).isEqualTo(i / 3);
            assertThat(records.get(i).replicate()).isEqualTo(i % 3);
            assertThat(records.get(i).combinationKey()).isEqualTo(GRID.combination(i / 3).key());
        }
        Set<ExperimentRecord.Key> keys = new HashSet<>();
        records.forEach(record -> assertThat(keys.add(record.key())).isTrue());
        assertThat(records).allSatisfy(record -> assertThat(record.outcome()).isNotEqualTo(TrialOutcome.FAILED));
    }

    @Test
    void equalSeedsGiveEqualRecords() {
        assertThat(runner(1, new InMemoryCheckpointStore()).run())
                .isEqualTo(runner(1, new InMemoryCheckpointStore()).run());
    }

    @Test
    void differentSeedsGiveDifferentTrajectories() {
        List<ExperimentRecord> first = runner(1, new InMemoryCheckpointStore()).run();
        List<ExperimentRecord> second = ExperimentRunner.builder()
                .modelFactory(FACTORY).grid(GRID).replicates(3).maxSteps(300).seed(8).build().run();

        assertThat(first).extracting(ExperimentRecord::terminalStep)
                .isNotEqualTo(second.stream().map(ExperimentRecord::terminalStep).toList());
    }

    @Test
    void parallelRunMatchesSequentialRun() {
        List<ExperimentRecord> sequential = runner(1, new InMemoryCheckpointStore()).run();
        List<ExperimentRecord> parallel = runner(4, new InMemoryCheckpointStore()).run();

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void resumedRunMatchesUninterruptedRun() {
        List<ExperimentRecord> uninterrupted = runner(1, new InMemoryCheckpointStore()).run();
        InMemoryCheckpointStore partial = new InMemoryCheckpointStore(uninterrupted.subList(0, 5));

        List<ExperimentRecord> resumed = runner(2, partial).run();

        assertThat(resumed).isEqualTo(uninterrupted);
        // Combination 1 was half done; combinations 1, 2 and 3 still had pending trials
        assertThat(partial.getAppendCalls()).isEqualTo(3);
        assertThat(partial.load()).hasSize(12);
    }

    @Test
    void completedSweepRunsNothing() {
        List<ExperimentRecord> uninterrupted = runner(1, new InMemoryCheckpointStore()).run();
        InMemoryCheckpointStore complete = new InMemoryCheckpointStore(uninterrupted);

        assertThat(runner(4, complete).run()).isEqualTo(uninterrupted);
        assertThat(complete.getAppendCalls()).isZero();
    }

    @Test
    void checkpointedRecordsAreMatchedByKeyNotIndex() {
        List<ExperimentRecord> uninterrupted = runner(1, new InMemoryCheckpointStore()).run();
        List<ExperimentRecord> shifted = new ArrayList<>();
        for (ExperimentRecord record : uninterrupted.subList(3, 6)) {
            shifted.add(record.withCombinationIndex(record.combinationIndex() + 40));
        }
        shifted.add(new ExperimentRecord(0, "adoption-rate=0.7;payoff.adaptive=1.0",
                Map.of("adoption-rate", 0.7, "payoff.adaptive", 1.0), 0, TrialOutcome.TIMED_OUT, 300, 0.5, null));

        List<ExperimentRecord> resumed = runner(1, new InMemoryCheckpointStore(shifted)).run();

        assertThat(resumed).isEqualTo(uninterrupted);
    }

    @Test
    void checkpointIntervalGroupsCombinationsIntoBatches() {
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();

        ExperimentRunner.builder()
                .modelFactory(FACTORY).grid(GRID).replicates(2).maxSteps(50).seed(1)
                .checkpointStore(store).checkpointInterval(3)
                .build().run();

        assertThat(store.getAppendCalls()).isEqualTo(2);
        assertThat(store.load()).hasSize(8);
    }

    @Test
    void gridIsNotModifiedByARun() {
        List<ParameterCombination> before = GRID.combinations();

        runner(2, new InMemoryCheckpointStore()).run();

        assertThat(GRID.combinations()).isEqualTo(before);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Model construction failed for combination size=0\\.0 .*", occurrences = 2)
    void constructionFailuresAreRecorded() {
        ModelFactory factory = (combination, random) -> new AgentBasedModel(
                NetworkFactory.complete(combination.getInt("size")),
                ModelParameters.builder(new ContagionLearning(), new DyadIndependentPayoff()).build(),
                List.of(), random);
        ParameterGrid grid = ParameterGrid.builder().add("size", 0, 4).build();

        List<ExperimentRecord> records = ExperimentRunner.builder()
                .modelFactory(factory).grid(grid).replicates(2).maxSteps(10).build().run();

        assertThat(records).hasSize(4);
        assertThat(records.subList(0, 2)).allSatisfy(record -> {
            assertThat(record.outcome()).isEqualTo(TrialOutcome.FAILED);
            assertThat(record.failureMessage()).contains("zero agents");
            assertThat(record.finalAdaptiveFraction()).isNaN();
        });
        assertThat(records.subList(2, 4)).allSatisfy(record ->
                assertThat(record.outcome()).isEqualTo(TrialOutcome.FIXATED_LEGACY));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Trial failed for combination .* at step 0: invariant broken", occurrences = 3)
    void trialFailuresDoNotAbortTheSweep() {
        ILearningStrategy broken = mock(ILearningStrategy.class);
        when(broken.decideAdoption(any(), any())).thenThrow(new RuntimeInvariantException("invariant broken"));
        ModelFactory factory = (combination, random) -> new AgentBasedModel(NetworkFactory.complete(4),
                ModelParameters.builder(broken, new DyadIndependentPayoff()).build(), List.of(0), random);

        List<ExperimentRecord> records = ExperimentRunner.builder()
                .modelFactory(factory).grid(ParameterGrid.builder().build()).replicates(3).maxSteps(10).parallelism(2)
                .build().run();

        assertThat(records).hasSize(3)
                .allSatisfy(record -> assertThat(record.failureMessage()).isEqualTo("invariant broken"));
        assertThat(records).extracting(ExperimentRecord::combinationKey).containsOnly("");
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> ExperimentRunner.builder().replicates(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExperimentRunner.builder().checkpointInterval(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExperimentRunner.builder().grid(GRID).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ExperimentRunner.builder().modelFactory(FACTORY).grid(GRID).parallelism(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void automaticParallelismUsesAtLeastOneThread() {
        assertThat(ExperimentRunner.builder().modelFactory(FACTORY).grid(GRID).parallelism(0).build().getParallelism())
                .isGreaterThanOrEqualTo(1);
    }

    private static ExperimentRunner runner(int parallelism, InMemoryCheckpointStore store) {
        return ExperimentRunner.builder()
                .modelFactory(FACTORY)
                .grid(GRID)
                .replicates(3)
                .maxSteps(300)
                .seed(7)
                .parallelism(parallelism)
                .checkpointStore(store)
                .build();
    }
}
