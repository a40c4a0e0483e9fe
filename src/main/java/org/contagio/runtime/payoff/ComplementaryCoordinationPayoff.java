package org.contagio.runtime.payoff;

import org.contagio.runtime.api.InvalidPayoffSpecException;
import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.spi.IDyadicPayoff;

import com.typesafe.config.Config;

/**
 * Role-complementary coordination: an interaction pays off when the partners perform
 * different roles and pays little or nothing when they perform the same role. The two
 * behaviors act as the two roles.
 * <p>
 * The role-compatibility matrix is either given explicitly as a {@code table} or derived
 * from {@code matched} (default 0) and {@code complementary} (default 1). Every complementary
 * cell must pay strictly more than every matched cell.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * payoff {
 *   type = "complementary"
 *   table {
 *     "legacy:legacy" = 0
 *     "legacy:adaptive" = 2
 *     "adaptive:legacy" = 1
 *     "adaptive:adaptive" = 0
 *   }
 * }
 * }</pre>
 */
public class ComplementaryCoordinationPayoff implements IDyadicPayoff {

    private DyadicPayoffTable table = symmetric(0.0, 1.0);

    public ComplementaryCoordinationPayoff() {
    }

    /**
     * @param table the role-compatibility matrix.
     * @throws InvalidPayoffSpecException if a matched cell pays at least as much as a complementary cell.
     */
    public ComplementaryCoordinationPayoff(DyadicPayoffTable table) {
        this.table = validate(table);
    }

    @Override
    public void initialize(Config options) {
        if (options.hasPath("table")) {
            this.table = validate(DyadicPayoffTable.fromConfig(options.getConfig("table"), "complementary"));
        } else {
            double matched = options.hasPath("matched") ? options.getDouble("matched") : 0.0;
            double complementary = options.hasPath("complementary") ? options.getDouble("complementary") : 1.0;
            this.table = validate(symmetric(matched, complementary));
        }
    }

    @Override
    public double payoff(Behavior own, Behavior partner) {
        return table.get(own, partner);
    }

    private static DyadicPayoffTable symmetric(double matched, double complementary) {
        return DyadicPayoffTable.builder()
                .set(Behavior.LEGACY, Behavior.LEGACY, matched)
                .set(Behavior.ADAPTIVE, Behavior.ADAPTIVE, matched)
                .set(Behavior.LEGACY, Behavior.ADAPTIVE, complementary)
                .set(Behavior.ADAPTIVE, Behavior.LEGACY, complementary)
                .build("complementary");
    }

    private static DyadicPayoffTable validate(DyadicPayoffTable table) {
        double bestMatched = Math.max(table.get(Behavior.LEGACY, Behavior.LEGACY),
                table.get(Behavior.ADAPTIVE, Behavior.ADAPTIVE));
        double worstComplementary = Math.min(table.get(Behavior.LEGACY, Behavior.ADAPTIVE),
                table.get(Behavior.ADAPTIVE, Behavior.LEGACY));
        if (worstComplementary <= bestMatched) {
            throw new InvalidPayoffSpecException("Complementary payoff requires every complementary role pair to pay more "
                    + "than every matched pair, got " + table);
        }
        return table;
    }
}
