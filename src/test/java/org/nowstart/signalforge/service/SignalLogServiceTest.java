package org.nowstart.signalforge.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.nowstart.signalforge.data.type.Recommendation;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.nowstart.signalforge.support.SignalFixtures;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class SignalLogServiceTest {

    private final SignalLogService service = new SignalLogService();

    @Test
    void logSignal_writesSignalLineWithSortedDiagnostics(CapturedOutput output) {
        StrategyEvaluation evaluation = SignalFixtures.evaluation(SignalDirection.BUY, SignalFixtures.openLevels());

        service.logSignal(record(List.of("Break of \"IB\" high", "Technical fallback")), evaluation);

        assertThat(output).contains("event=signal symbol=EURUSD strategy_version=adaptive-v1 ts=2026-01-05T11:00:00Z direction=BUY");
        assertThat(output).contains("calibration_version=none");
        assertThat(output).contains("reasons=\"Break of \\\"IB\\\" high; Technical fallback\"");
        assertThat(output).contains("diagnostics={indicator.adx=30.0, regime.current=\"TREND\", session.market_closed=0.0}");
    }

    @Test
    void logSignal_emitsDiagnosticSeriesOnlyForNumericAndBooleanValues(CapturedOutput output) {
        StrategyEvaluation evaluation = SignalFixtures.evaluation(SignalDirection.BUY, SignalFixtures.openLevels());

        service.logSignal(record(List.of()), evaluation);

        assertThat(output).containsPattern("event=strategy_diagnostic[^\\n]*key=indicator\\.adx[^\\n]*label=\\\"ADX\\\"[^\\n]*value=30\\.0");
        assertThat(output).containsPattern("event=strategy_diagnostic[^\\n]*key=session\\.market_closed[^\\n]*value=0\\.0");
        assertThat(output).doesNotContainPattern("event=strategy_diagnostic[^\\n]*key=regime\\.current");
    }

    private SignalRecord record(List<String> reasons) {
        return new SignalRecord(
                "EURUSD",
                SignalDirection.BUY,
                78.9,
                Recommendation.STRONG,
                2.0,
                2.0,
                1.0860,
                1.0835,
                1.0909,
                1.96,
                25.0,
                MarketRegime.TREND,
                StrategyMode.TREND,
                30.0,
                40.0,
                true,
                60.0,
                null,
                "adaptive-v1",
                Instant.parse("2026-01-05T11:00:00Z"),
                reasons,
                Map.of()
        );
    }
}
