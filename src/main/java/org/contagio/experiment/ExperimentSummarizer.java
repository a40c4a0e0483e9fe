package org.contagio.experiment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.contagio.runtime.TrialOutcome;

/**
 * Groups experiment records by parameter columns and aggregates each group into a
 * {@link SummaryRow}.
 */
public final class ExperimentSummarizer {

    private ExperimentSummarizer() {
    }

    /**
     * Summarizes records grouped by the given parameters.
     * <p>
     * Rows appear in the order their group is first seen. Time to fixation counts every record
     * that fixated, on either behavior. An empty {@code groupBy} yields a single row over all
     * records.
     *
     * @param records the records.
     * @param groupBy the parameter names to group by.
     * @return one row per distinct value tuple.
     * @throws IllegalArgumentException if a record lacks a group-by parameter.
     */
    public static List<SummaryRow> summarize(List<ExperimentRecord> records, List<String> groupBy) {
        Map<List<Object>, List<ExperimentRecord>> groups = new LinkedHashMap<>();
        for (ExperimentRecord record : records) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (String name : groupBy) {
                if (!record.parameters().containsKey(name)) {
                    throw new IllegalArgumentException("Record " + record.key() + " has no parameter '" + name
                            + "'; available: " + record.parameters().keySet());
                }
                key.add(record.parameters().get(name));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<SummaryRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<ExperimentRecord>> entry : groups.entrySet()) {
            Map<String, Object> group = new LinkedHashMap<>();
            for (int i = 0; i < groupBy.size(); i++) {
                group.put(groupBy.get(i), entry.getKey().get(i));
            }
            rows.add(aggregate(group, entry.getValue()));
        }
        return rows;
    }

    private static SummaryRow aggregate(Map<String, Object> group, List<ExperimentRecord> records) {
        DescriptiveStatistics fixationTimes = new DescriptiveStatistics();
        DescriptiveStatistics finalFractions = new DescriptiveStatistics();
        int successes = 0;
        int timedOut = 0;
        int failed = 0;
        for (ExperimentRecord record : records) {
            if (record.success()) {
                successes++;
            }
            if (record.outcome().isFixation()) {
                fixationTimes.addValue(record.terminalStep());
            } else if (record.outcome() == TrialOutcome.TIMED_OUT) {
                timedOut++;
            } else if (record.outcome() == TrialOutcome.FAILED) {
                failed++;
            }
            if (!Double.isNaN(record.finalAdaptiveFraction())) {
                finalFractions.addValue(record.finalAdaptiveFraction());
            }
        }
        double successRate = records.isEmpty() ? Double.NaN : (double) successes / records.size();
        return new SummaryRow(group, records.size(), successRate,
                fixationTimes.getMean(), fixationTimes.getStandardDeviation(),
                timedOut, failed, finalFractions.getMean());
    }
}
