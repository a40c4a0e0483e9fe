package org.contagio.runtime.payoff;

import java.util.Arrays;
import java.util.Locale;

import org.contagio.runtime.api.InvalidPayoffSpecException;
import org.contagio.runtime.model.Behavior;

import com.typesafe.config.Config;

/**
 * A complete 2x2 table of payoffs for (own behavior, partner behavior).
 * <p>
 * Tables are immutable once built. Configuration keys use the form {@code "own:partner"},
 * e.g. {@code "adaptive:legacy"}.
 */
public final class DyadicPayoffTable {

    private static final int SIZE = Behavior.values().length;

    private final double[] values;

    private DyadicPayoffTable(double[] values) {
        this.values = values;
    }

    /**
     * @return a builder whose cells are all unset.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a table from a HOCON block whose keys are {@code "own:partner"} pairs.
     *
     * @param table the table block.
     * @param name the payoff name for error messages.
     * @return the table.
     * @throws InvalidPayoffSpecException if a key is malformed or a combination is missing.
     */
    public static DyadicPayoffTable fromConfig(Config table, String name) {
        Builder builder = builder();
        for (String key : table.root().keySet()) {
            String[] parts = key.split(":");
            if (parts.length != 2) {
                throw new InvalidPayoffSpecException("Invalid " + name + " payoff key: '" + key
                        + "'. Expected 'own:partner' (e.g. 'adaptive:legacy')");
            }
            Behavior own;
            Behavior partner;
            try {
                own = Behavior.valueOf(parts[0].trim().toUpperCase(Locale.ROOT));
                partner = Behavior.valueOf(parts[1].trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidPayoffSpecException("Unknown behavior in " + name + " payoff key: '" + key + "'");
            }
            builder.set(own, partner, table.getDouble("\"" + key + "\""));
        }
        return builder.build(name);
    }

    public double get(Behavior own, Behavior partner) {
        return values[own.ordinal() * SIZE + partner.ordinal()];
    }

    @Override
    public String toString() {
        return "DyadicPayoffTable" + Arrays.toString(values);
    }

    /**
     * Collects table cells; {@link #build(String)} validates completeness.
     */
    public static final class Builder {

        private final double[] values = new double[SIZE * SIZE];
        private final boolean[] present = new boolean[SIZE * SIZE];

        private Builder() {
        }

        public Builder set(Behavior own, Behavior partner, double value) {
            int cell = own.ordinal() * SIZE + partner.ordinal();
            values[cell] = value;
            present[cell] = true;
            return this;
        }

        /**
         * @param name the payoff name for error messages.
         * @return the validated table.
         * @throws InvalidPayoffSpecException if a combination is missing or a value is negative.
         */
        public DyadicPayoffTable build(String name) {
            for (Behavior own : Behavior.values()) {
                for (Behavior partner : Behavior.values()) {
                    int cell = own.ordinal() * SIZE + partner.ordinal();
                    if (!present[cell]) {
                        throw new InvalidPayoffSpecException("The " + name + " payoff table does not cover ("
                                + own + ", " + partner + ")");
                    }
                    double value = values[cell];
                    if (value < 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
                        throw new InvalidPayoffSpecException("The " + name + " payoff for (" + own + ", " + partner
                                + ") must be a finite non-negative value, got " + value);
                    }
                }
            }
            return new DyadicPayoffTable(values.clone());
        }
    }
}
