package org.nowstart.signalforge.service;

import java.util.Comparator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.strategy.core.StrategyDiagnostic;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SignalLogService {

    public void logSignal(SignalRecord record, StrategyEvaluation evaluation) {
        log.info(
                "event=signal symbol={} strategy_version={} ts={} direction={} confidence={} recommendation={} actionable={} threshold={} calibration_version={} regime={} mode={} entry={} stop_loss={} take_profit={} rr_ratio={} stop_pips={} position_size={} intensity={} adx={} choppiness={} reasons=\"{}\" diagnostics={}",
                record.symbol(),
                record.strategyVersion(),
                record.generatedAt(),
                record.direction(),
                sanitizeMetricForLog(record.confidence()),
                record.recommendation(),
                record.actionable(),
                sanitizeMetricForLog(record.threshold()),
                record.calibrationVersion() == null ? "none" : record.calibrationVersion(),
                record.regime(),
                record.mode(),
                sanitizeMetricForLog(record.entryPrice()),
                sanitizeMetricForLog(record.stopLoss()),
                sanitizeMetricForLog(record.takeProfit()),
                sanitizeMetricForLog(record.riskRewardRatio()),
                sanitizeMetricForLog(record.stopDistancePips()),
                sanitizeMetricForLog(record.positionSizeMultiplier()),
                sanitizeMetricForLog(record.finalIntensity()),
                sanitizeMetricForLog(record.adx()),
                sanitizeMetricForLog(record.choppiness()),
                escape(String.join("; ", record.reasons())),
                formatDiagnosticValues(evaluation)
        );

        emitStrategyDiagnostics(record, evaluation);
    }

    private void emitStrategyDiagnostics(SignalRecord record, StrategyEvaluation evaluation) {
        for (StrategyDiagnostic diagnostic : evaluation.diagnostics()) {
            if (!diagnostic.type().emitsSeries()) {
                continue;
            }
            log.info(
                    "event=strategy_diagnostic symbol={} strategy_version={} ts={} key={} label=\"{}\" unit=\"{}\" value={} direction={} actionable={}",
                    record.symbol(),
                    record.strategyVersion(),
                    record.generatedAt(),
                    diagnostic.key(),
                    escape(diagnostic.label()),
                    escape(diagnostic.unit()),
                    sanitizeMetricForLog(diagnostic.numericValue()),
                    record.direction(),
                    record.actionable()
            );
        }
    }

    private String formatDiagnosticValues(StrategyEvaluation evaluation) {
        return evaluation.diagnostics().stream()
                .sorted(Comparator.comparing(StrategyDiagnostic::key))
                .map(item -> item.key() + "=" + formatDiagnosticValue(item))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private String formatDiagnosticValue(StrategyDiagnostic diagnostic) {
        if (!diagnostic.type().emitsSeries()) {
            return "\"" + escape(String.valueOf(diagnostic.value())) + "\"";
        }
        return Double.toString(sanitizeMetricForLog(diagnostic.numericValue()));
    }

    private String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
