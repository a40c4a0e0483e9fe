package org.contagio.runtime;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.contagio.runtime.model.Behavior;

/**
 * Population-level statistics after one step (or of the initial configuration, step 0).
 *
 * @param step the step index.
 * @param legacyCount the number of agents performing {@link Behavior#LEGACY}.
 * @param adaptiveCount the number of agents performing {@link Behavior#ADAPTIVE}.
 * @param measures named model measures, in registration order.
 */
public record StepSummary(long step, int legacyCount, int adaptiveCount, Map<String, Double> measures) {

    public StepSummary {
        measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
    }

    public int count(Behavior behavior) {
        return behavior == Behavior.ADAPTIVE ? adaptiveCount : legacyCount;
    }

    /**
     * @return the behavior-to-count mapping.
     */
    public Map<Behavior, Integer> counts() {
        EnumMap<Behavior, Integer> counts = new EnumMap<>(Behavior.class);
        counts.put(Behavior.LEGACY, legacyCount);
        counts.put(Behavior.ADAPTIVE, adaptiveCount);
        return counts;
    }

    public int total() {
        return legacyCount + adaptiveCount;
    }

    public double adaptiveFraction() {
        int total = total();
        return total == 0 ? 0.0 : (double) adaptiveCount / total;
    }

    /**
     * @return the behavior shared by every agent, or empty while both behaviors coexist.
     */
    public Optional<Behavior> fixatedBehavior() {
        if (adaptiveCount == 0 && legacyCount > 0) {
            return Optional.of(Behavior.LEGACY);
        }
        if (legacyCount == 0 && adaptiveCount > 0) {
            return Optional.of(Behavior.ADAPTIVE);
        }
        return Optional.empty();
    }
}
