package org.contagio.experiment.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.contagio.experiment.ExperimentRecord;
import org.contagio.junit.extensions.logging.ExpectLog;
import org.contagio.junit.extensions.logging.LogLevel;
import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.contagio.runtime.TrialOutcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class JsonLinesCheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileLoadsAsEmpty() {
        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(tempDir.resolve("sweep.jsonl"))) {
            assertThat(store.load()).isEmpty();
        }
    }

    @Test
    void appendedRecordsSurviveReopening() {
        Path file = tempDir.resolve("sweep.jsonl");
        List<ExperimentRecord> written = List.of(
                record(0, 0, TrialOutcome.FIXATED_ADAPTIVE, 0.9),
                record(0, 1, TrialOutcome.FAILED, Double.NaN),
                record(1, 0, TrialOutcome.TIMED_OUT, 0.25));
        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file)) {
            store.load();
            store.append(written.subList(0, 2));
            store.append(written.subList(2, 3));
        }

        try (JsonLinesCheckpointStore reopened = new JsonLinesCheckpointStore(file)) {
            assertThat(reopened.load()).isEqualTo(written);
        }
    }

    @Test
    void appendIsIdempotentPerKey() throws IOException {
        Path file = tempDir.resolve("sweep.jsonl");
        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file)) {
            store.load();
            store.append(List.of(record(0, 0, TrialOutcome.TIMED_OUT, 0.5)));
            store.append(List.of(record(0, 0, TrialOutcome.TIMED_OUT, 0.5), record(0, 1, TrialOutcome.TIMED_OUT, 0.5)));
        }

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(2);
    }

    @Test
    void corruptFileAbortsByDefault() throws IOException {
        Path file = corruptCheckpoint();

        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file)) {
            assertThatThrownBy(store::load)
                    .isInstanceOf(CheckpointException.class)
                    .hasMessageContaining("line 3");
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "(?s).*corrupt at line 3.*keeping 2 records written before it")
    void recoverKeepsTheValidPrefixAndTruncatesTheFile() throws IOException {
        Path file = corruptCheckpoint();

        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file, CorruptCheckpointPolicy.RECOVER)) {
            List<ExperimentRecord> loaded = store.load();
            assertThat(loaded).extracting(ExperimentRecord::replicate).containsExactly(0, 1);
            store.append(List.of(record(0, 2, TrialOutcome.FIXATED_LEGACY, 0.0)));
        }

        try (JsonLinesCheckpointStore reopened = new JsonLinesCheckpointStore(file)) {
            assertThat(reopened.load()).extracting(ExperimentRecord::replicate).containsExactly(0, 1, 2);
        }
        assertThat(tempDir.resolve("sweep.jsonl.tmp")).doesNotExist();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "(?s).*discarding it and starting fresh")
    void startFreshDiscardsEverything() throws IOException {
        Path file = corruptCheckpoint();

        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file, CorruptCheckpointPolicy.START_FRESH)) {
            assertThat(store.load()).isEmpty();
        }

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void recordWithMissingFieldIsCorrupt() throws IOException {
        Path file = tempDir.resolve("sweep.jsonl");
        Files.writeString(file, "{\"combinationKey\":\"a=1.0\",\"parameters\":{}}\n", StandardCharsets.UTF_8);

        try (JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(file)) {
            assertThatThrownBy(store::load)
                    .isInstanceOf(CheckpointException.class)
                    .hasMessageContaining("combinationIndex");
        }
    }

    @Test
    void closedStoreRejectsUse() {
        JsonLinesCheckpointStore store = new JsonLinesCheckpointStore(tempDir.resolve("sweep.jsonl"));
        store.close();
        store.close();

        assertThatThrownBy(store::load).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.append(List.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void policyNamesParseWithDashes() {
        assertThat(CorruptCheckpointPolicy.parse("start-fresh")).isEqualTo(CorruptCheckpointPolicy.START_FRESH);
        assertThat(CorruptCheckpointPolicy.parse(" Recover ")).isEqualTo(CorruptCheckpointPolicy.RECOVER);
    }

    private Path corruptCheckpoint() throws IOException {
        Path file = tempDir.resolve("sweep.jsonl");
        String valid = ExperimentRecordCodec.encode(record(0, 0, TrialOutcome.FIXATED_ADAPTIVE, 1.0)) + "\n"
                + ExperimentRecordCodec.encode(record(0, 1, TrialOutcome.TIMED_OUT, 0.5)) + "\n";
        // A crash mid-write leaves a truncated final line
        Files.writeString(file, valid + "{\"combinationIndex\":0,\"combinationKey\":\"adoption-ra", StandardCharsets.UTF_8);
        return file;
    }

    static ExperimentRecord record(int combination, int replicate, TrialOutcome outcome, double fraction) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("adoption-rate", combination == 0 ? 0.5 : 1.0);
        parameters.put("learning.strategy", "success-biased");
        parameters.put("sequential", false);
        String key = "adoption-rate=" + parameters.get("adoption-rate") + ";learning.strategy=success-biased;sequential=false";
        return new ExperimentRecord(combination, key, parameters, replicate, outcome, 40L + replicate, fraction,
                outcome == TrialOutcome.FAILED ? "Agent 3 has no neighbors" : null);
    }
}
