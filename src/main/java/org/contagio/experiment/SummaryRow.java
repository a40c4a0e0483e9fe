package org.contagio.experiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate of all records sharing one group-by value tuple.
 *
 * @param group the group-by parameter values.
 * @param replicates the number of records in the group.
 * @param successRate the fraction of records that fixated on the adaptive behavior.
 * @param meanTimeToFixation the mean terminal step of fixated records, {@code NaN} if none fixated.
 * @param stdTimeToFixation the sample standard deviation of those steps, {@code NaN} if none fixated.
 * @param timedOut the number of timed-out records.
 * @param failed the number of failed records.
 * @param meanFinalAdaptiveFraction the mean final adaptive fraction over records that report one.
 */
public record SummaryRow(Map<String, Object> group, int replicates, double successRate,
                         double meanTimeToFixation, double stdTimeToFixation, int timedOut, int failed,
                         double meanFinalAdaptiveFraction) {

    public SummaryRow {
        group = Collections.unmodifiableMap(new LinkedHashMap<>(group));
    }
}
