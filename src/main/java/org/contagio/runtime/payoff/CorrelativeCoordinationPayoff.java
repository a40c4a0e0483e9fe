package org.contagio.runtime.payoff;

import org.contagio.runtime.api.InvalidPayoffSpecException;
import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.spi.IDyadicPayoff;

import com.typesafe.config.Config;

/**
 * Cooperation dilemma payoffs. The adaptive behavior is cooperation, the legacy behavior is
 * defection:
 * <pre>
 *                  partner C   partner D
 *   own C (ADAPT)      R           S
 *   own D (LEGACY)     T           P
 * </pre>
 * The four values must satisfy {@code T > R > P > S >= 0}.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * payoff {
 *   type = "correlative"
 *   temptation = 5
 *   reward = 3
 *   punishment = 1
 *   sucker = 0
 * }
 * }</pre>
 */
public class CorrelativeCoordinationPayoff implements IDyadicPayoff {

    private DyadicPayoffTable table;

    public CorrelativeCoordinationPayoff() {
    }

    /**
     * Creates the payoff from the four dilemma values.
     */
    public CorrelativeCoordinationPayoff(double temptation, double reward, double punishment, double sucker) {
        this.table = buildTable(temptation, reward, punishment, sucker);
    }

    @Override
    public void initialize(Config options) {
        for (String key : new String[] {"temptation", "reward", "punishment", "sucker"}) {
            if (!options.hasPath(key)) {
                throw new InvalidPayoffSpecException("Correlative payoff is missing '" + key
                        + "'; temptation, reward, punishment and sucker are all required");
            }
        }
        this.table = buildTable(options.getDouble("temptation"), options.getDouble("reward"),
                options.getDouble("punishment"), options.getDouble("sucker"));
    }

    @Override
    public double payoff(Behavior own, Behavior partner) {
        if (table == null) {
            throw new IllegalStateException("CorrelativeCoordinationPayoff used before initialization");
        }
        return table.get(own, partner);
    }

    private static DyadicPayoffTable buildTable(double temptation, double reward, double punishment, double sucker) {
        if (!(temptation > reward && reward > punishment && punishment > sucker)) {
            throw new InvalidPayoffSpecException("Correlative payoff requires temptation > reward > punishment > sucker, got T="
                    + temptation + ", R=" + reward + ", P=" + punishment + ", S=" + sucker);
        }
        return DyadicPayoffTable.builder()
                .set(Behavior.ADAPTIVE, Behavior.ADAPTIVE, reward)
                .set(Behavior.ADAPTIVE, Behavior.LEGACY, sucker)
                .set(Behavior.LEGACY, Behavior.ADAPTIVE, temptation)
                .set(Behavior.LEGACY, Behavior.LEGACY, punishment)
                .build("correlative");
    }
}
