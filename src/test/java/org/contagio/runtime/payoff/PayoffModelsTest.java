package org.contagio.runtime.payoff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.api.InvalidPayoffSpecException;
import org.contagio.runtime.api.UnknownStrategyException;
import org.contagio.runtime.model.Behavior;
import org.contagio.runtime.spi.IDyadIndependentPayoff;
import org.contagio.runtime.spi.IDyadicPayoff;
import org.contagio.runtime.spi.IPayoffModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PayoffModelsTest {

    private static final Behavior L = Behavior.LEGACY;
    private static final Behavior A = Behavior.ADAPTIVE;

    @Test
    void dyadIndependentDefaultsToNeutralFitness() {
        DyadIndependentPayoff payoff = new DyadIndependentPayoff();

        assertThat(payoff.payoff(L)).isEqualTo(1.0);
        assertThat(payoff.payoff(A)).isEqualTo(1.0);
    }

    @Test
    void dyadIndependentReadsOptions() {
        IPayoffModel model = PayoffModelRegistry.fromConfig(ConfigFactory.parseString("legacy = 0.5\nadaptive = 2"));

        assertThat(model).isInstanceOf(IDyadIndependentPayoff.class);
        assertThat(((IDyadIndependentPayoff) model).payoff(L)).isEqualTo(0.5);
        assertThat(((IDyadIndependentPayoff) model).payoff(A)).isEqualTo(2.0);
    }

    @Test
    void dyadIndependentRejectsNegativeFitness() {
        assertThatThrownBy(() -> new DyadIndependentPayoff(1.0, -0.1))
                .isInstanceOf(InvalidPayoffSpecException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void correlativeMapsTheDilemmaTable() {
        CorrelativeCoordinationPayoff payoff = new CorrelativeCoordinationPayoff(5, 3, 1, 0);

        assertThat(payoff.payoff(A, A)).isEqualTo(3.0);
        assertThat(payoff.payoff(A, L)).isEqualTo(0.0);
        assertThat(payoff.payoff(L, A)).isEqualTo(5.0);
        assertThat(payoff.payoff(L, L)).isEqualTo(1.0);
    }

    @Test
    void correlativeEnforcesTheOrdering() {
        assertThatThrownBy(() -> new CorrelativeCoordinationPayoff(3, 5, 1, 0))
                .isInstanceOf(InvalidPayoffSpecException.class)
                .hasMessageContaining("temptation > reward > punishment > sucker");
    }

    @Test
    void correlativeRequiresAllFourValues() {
        assertThatThrownBy(() -> PayoffModelRegistry.fromConfig(ConfigFactory.parseString(
                "type = correlative\ntemptation = 5\nreward = 3\npunishment = 1")))
                .isInstanceOf(InvalidPayoffSpecException.class)
                .hasMessageContaining("sucker");
    }

    @Test
    void complementaryDefaultRewardsMismatchedRoles() {
        IPayoffModel model = PayoffModelRegistry.create(PayoffModelRegistry.COMPLEMENTARY, ConfigFactory.empty());

        IDyadicPayoff payoff = (IDyadicPayoff) model;
        assertThat(payoff.payoff(A, L)).isEqualTo(1.0);
        assertThat(payoff.payoff(L, A)).isEqualTo(1.0);
        assertThat(payoff.payoff(A, A)).isEqualTo(0.0);
        assertThat(payoff.payoff(L, L)).isEqualTo(0.0);
    }

    @Test
    void complementaryReadsAnExplicitTable() {
        IDyadicPayoff payoff = (IDyadicPayoff) PayoffModelRegistry.fromConfig(ConfigFactory.parseString(
                "type = complementary\n"
                        + "table { \"adaptive:legacy\" = 3, \"legacy:adaptive\" = 2, "
                        + "\"adaptive:adaptive\" = 1, \"legacy:legacy\" = 0.5 }"));

        assertThat(payoff.payoff(A, L)).isEqualTo(3.0);
        assertThat(payoff.payoff(L, A)).isEqualTo(2.0);
        assertThat(payoff.payoff(L, L)).isEqualTo(0.5);
    }

    @Test
    void complementaryRejectsTablesWhereMatchingPaysMore() {
        DyadicPayoffTable table = DyadicPayoffTable.builder()
                .set(A, A, 2).set(L, L, 0).set(A, L, 1).set(L, A, 3)
                .build("complementary");

        assertThatThrownBy(() -> new ComplementaryCoordinationPayoff(table))
                .isInstanceOf(InvalidPayoffSpecException.class);
    }

    @Test
    void tableMustCoverEveryPair() {
        assertThatThrownBy(() -> DyadicPayoffTable.builder().set(A, A, 1).set(L, L, 1).set(A, L, 1).build("partial"))
                .isInstanceOf(InvalidPayoffSpecException.class)
                .hasMessageContaining("(LEGACY, ADAPTIVE)");
    }

    @Test
    void tableRejectsUnknownBehaviorKeys() {
        assertThatThrownBy(() -> DyadicPayoffTable.fromConfig(
                ConfigFactory.parseString("\"adaptive:cooperate\" = 1"), "complementary"))
                .isInstanceOf(InvalidPayoffSpecException.class)
                .hasMessageContaining("adaptive:cooperate");
    }

    @Test
    void registryRejectsUnknownTypes() {
        assertThatThrownBy(() -> PayoffModelRegistry.fromConfig(ConfigFactory.parseString("type = zero-sum")))
                .isInstanceOf(UnknownStrategyException.class);
        assertThatThrownBy(() -> PayoffModelRegistry.create("java.lang.Object", ConfigFactory.empty()))
                .isInstanceOf(UnknownStrategyException.class)
                .hasMessageContaining("implements neither");
    }

    @Test
    void registryWrapsMistypedOptions() {
        assertThatThrownBy(() -> PayoffModelRegistry.fromConfig(ConfigFactory.parseString("adaptive = lots")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("dyad-independent");
    }
}
