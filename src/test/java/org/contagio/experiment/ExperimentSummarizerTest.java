package org.contagio.experiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.contagio.runtime.TrialOutcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ExperimentSummarizerTest {

    private static final List<ExperimentRecord> RECORDS = List.of(
            record(0, 0.5, "contagion", 0, TrialOutcome.FIXATED_ADAPTIVE, 10, 1.0),
            record(0, 0.5, "contagion", 1, TrialOutcome.FIXATED_ADAPTIVE, 20, 1.0),
            record(0, 0.5, "contagion", 2, TrialOutcome.FIXATED_LEGACY, 30, 0.0),
            record(0, 0.5, "contagion", 3, TrialOutcome.TIMED_OUT, 100, 0.4),
            record(1, 1.0, "contagion", 0, TrialOutcome.FAILED, 0, Double.NaN),
            record(1, 1.0, "contagion", 1, TrialOutcome.TIMED_OUT, 100, 0.6));

    @Test
    void aggregatesEachGroup() {
        List<SummaryRow> rows = ExperimentSummarizer.summarize(RECORDS, List.of("adoption-rate"));

        assertThat(rows).hasSize(2);
        SummaryRow first = rows.get(0);
        assertThat(first.group()).containsExactly(Map.entry("adoption-rate", 0.5));
        assertThat(first.replicates()).isEqualTo(4);
        assertThat(first.successRate()).isEqualTo(0.5);
        // Fixation on either behavior counts toward the time to fixation
        assertThat(first.meanTimeToFixation()).isEqualTo(20.0);
        assertThat(first.stdTimeToFixation()).isCloseTo(10.0, within(1e-9));
        assertThat(first.timedOut()).isEqualTo(1);
        assertThat(first.failed()).isZero();
        assertThat(first.meanFinalAdaptiveFraction()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    void groupWithoutFixationHasNoFixationTime() {
        SummaryRow second = ExperimentSummarizer.summarize(RECORDS, List.of("adoption-rate")).get(1);

        assertThat(second.successRate()).isZero();
        assertThat(second.meanTimeToFixation()).isNaN();
        assertThat(second.failed()).isEqualTo(1);
        assertThat(second.timedOut()).isEqualTo(1);
        assertThat(second.meanFinalAdaptiveFraction()).isEqualTo(0.6);
    }

    @Test
    void emptyGroupingCollapsesEverything() {
        List<SummaryRow> rows = ExperimentSummarizer.summarize(RECORDS, List.of());

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).group()).isEmpty();
        assertThat(rows.get(0).replicates()).isEqualTo(6);
        assertThat(rows.get(0).successRate()).isCloseTo(2.0 / 6.0, within(1e-12));
    }

    @Test
    void groupsFollowFirstAppearance() {
        List<SummaryRow> rows = ExperimentSummarizer.summarize(RECORDS, List.of("learning.strategy", "adoption-rate"));

        assertThat(rows).extracting(row -> row.group().get("adoption-rate")).containsExactly(0.5, 1.0);
        assertThat(rows.get(0).group().keySet()).containsExactly("learning.strategy", "adoption-rate");
    }

    @Test
    void unknownGroupingParameterIsRejected() {
        assertThatThrownBy(() -> ExperimentSummarizer.summarize(RECORDS, List.of("drop-rate")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("drop-rate");
    }

    @Test
    void noRecordsGiveNoRows() {
        assertThat(ExperimentSummarizer.summarize(List.of(), List.of("adoption-rate"))).isEmpty();
    }

    private static ExperimentRecord record(int combination, double adoptionRate, String strategy, int replicate,
                                           TrialOutcome outcome, long terminalStep, double finalFraction) {
        Map<String, Object> parameters = Map.of("adoption-rate", adoptionRate, "learning.strategy", strategy);
        String key = "adoption-rate=" + adoptionRate + ";learning.strategy=" + strategy;
        return new ExperimentRecord(combination, key, parameters, replicate, outcome, terminalStep, finalFraction,
                outcome == TrialOutcome.FAILED ? "failed" : null);
    }
}
