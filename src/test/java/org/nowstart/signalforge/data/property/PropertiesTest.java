package org.nowstart.signalforge.data.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.signalforge.data.type.SymbolClass;

class PropertiesTest {

    @Test
    void riskProperties_mergesOverridesWithDefaultInstruments() {
        RiskProperties properties = new RiskProperties(
                Map.of(SymbolClass.METAL, new RiskProperties.InstrumentSpec(0.01, 80, 10.0)),
                1.5, 2.0, 1.5, 2.5, 2.0, 1.5, 2.5, 2.0, 2.0
        );

        assertThat(properties.instrument(SymbolClass.METAL).minStopPips()).isEqualTo(80);
        assertThat(properties.instrument(SymbolClass.MAJOR_FX).pipSize()).isEqualTo(0.0001);
    }

    @Test
    void modulationWeights_mustSumToOne() {
        assertThatThrownBy(() -> new ModulationProperties.Weights(0.5, 0.25, 0.20, 0.15, 0.10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    void calibrationProperties_sortsAndDeduplicatesThresholds() {
        CalibrationProperties properties = new CalibrationProperties(
                Duration.ofDays(30),
                List.of(70, 50, 60, 50),
                100,
                10,
                0.6,
                0.4,
                Duration.ofSeconds(30),
                "0 0 3 1 * *"
        );

        assertThat(properties.thresholds()).containsExactly(50, 60, 70);
    }

    @Test
    void sessionProperties_fallsBackToDefaultSessions() {
        SessionProperties properties = new SessionProperties(null, List.of(), Duration.ofMinutes(60), Duration.ofMinutes(15), 20);

        assertThat(properties.sessions()).extracting(SessionProperties.SessionWindow::name)
                .containsExactly("ASIAN", "LONDON", "NEW_YORK");
        assertThat(properties.sessions().get(0).hasInitialBalance()).isFalse();
        assertThat(properties.sessions().get(1).contains(7)).isTrue();
        assertThat(properties.sessions().get(1).contains(12)).isFalse();
    }

    @Test
    void sessionWindow_rejectsInitialBalanceHourOutsideDay() {
        assertThatThrownBy(() -> new SessionProperties.SessionWindow("LONDON", 7, 12, 24))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("ibStartHour must be within 0..23 for session LONDON");
        assertThatThrownBy(() -> new SessionProperties.SessionWindow("LONDON", 7, 12, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SessionProperties.SessionWindow("LATE", 20, 24, 23).ibStartHour()).isEqualTo(23);
    }

    @Test
    void regimeProperties_rejectsOverlappingChoppinessBands() {
        assertThatThrownBy(() -> new RegimeProperties(14, 14, 25.0, 70.0, 61.8))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
