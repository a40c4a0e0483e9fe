package org.contagio.runtime.spi;

import java.util.Map;

import org.contagio.runtime.api.InvalidParameterException;

import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/**
 * The adoption-rate gate applied after a strategy's base probability.
 * <p>
 * Holds the global adoption rate α and optional per-dyad overrides α<sub>ij</sub> keyed by
 * (focal id, teacher id). Instances are immutable.
 */
public final class AdoptionRates {

    private static final AdoptionRates NO_GATE = new AdoptionRates(1.0, new Long2DoubleOpenHashMap());

    private final double baseRate;
    private final Long2DoubleOpenHashMap overrides;

    private AdoptionRates(double baseRate, Long2DoubleOpenHashMap overrides) {
        this.baseRate = baseRate;
        this.overrides = overrides;
    }

    /**
     * @return rates that never block an adoption (α = 1, no overrides).
     */
    public static AdoptionRates none() {
        return NO_GATE;
    }

    /**
     * @param rate the global adoption rate α.
     * @return rates without dyadic overrides.
     */
    public static AdoptionRates uniform(double rate) {
        return new AdoptionRates(InvalidParameterException.requireProbability("adoption rate", rate),
                new Long2DoubleOpenHashMap());
    }

    /**
     * Returns a copy of these rates with one dyadic override added.
     *
     * @param focalId the learner id.
     * @param teacherId the teacher id.
     * @param rate α<sub>ij</sub> for this ordered pair.
     * @return the new rates.
     */
    public AdoptionRates withOverride(int focalId, int teacherId, double rate) {
        return withOverrides(Map.of(new Dyad(focalId, teacherId), rate));
    }

    /**
     * Returns a copy of these rates with the given dyadic overrides added.
     *
     * @param dyadRates α<sub>ij</sub> per ordered pair.
     * @return the new rates.
     */
    public AdoptionRates withOverrides(Map<Dyad, Double> dyadRates) {
        Long2DoubleOpenHashMap copy = new Long2DoubleOpenHashMap(overrides);
        for (Map.Entry<Dyad, Double> entry : dyadRates.entrySet()) {
            Dyad dyad = entry.getKey();
            double rate = InvalidParameterException.requireProbability(
                    "adoption rate for dyad (" + dyad.focalId() + ", " + dyad.teacherId() + ")", entry.getValue());
            copy.put(key(dyad.focalId(), dyad.teacherId()), rate);
        }
        return new AdoptionRates(baseRate, copy);
    }

    /**
     * @param focalId the learner id.
     * @param teacherId the teacher id.
     * @return α<sub>ij</sub> if overridden, otherwise α.
     */
    public double rateFor(int focalId, int teacherId) {
        if (overrides.isEmpty()) {
            return baseRate;
        }
        long key = key(focalId, teacherId);
        return overrides.containsKey(key) ? overrides.get(key) : baseRate;
    }

    public double getBaseRate() {
        return baseRate;
    }

    public boolean hasOverrides() {
        return !overrides.isEmpty();
    }

    private static long key(int focalId, int teacherId) {
        return ((long) focalId << 32) | (teacherId & 0xFFFFFFFFL);
    }

    /**
     * An ordered (learner, teacher) pair.
     *
     * @param focalId the learner id.
     * @param teacherId the teacher id.
     */
    public record Dyad(int focalId, int teacherId) {}
}
