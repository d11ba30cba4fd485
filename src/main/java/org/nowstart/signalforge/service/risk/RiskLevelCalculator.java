package org.nowstart.signalforge.service.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.RiskInput;
import org.nowstart.signalforge.data.dto.RiskLevels;
import org.nowstart.signalforge.data.property.RiskProperties;
import org.nowstart.signalforge.data.property.RiskProperties.InstrumentSpec;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.springframework.stereotype.Service;

/**
 * Places stop-loss and take-profit from ATR, spread and the symbol-class minimum stop.
 * The result always satisfies {@code SL < entry < TP} for BUY and {@code TP < entry < SL} for SELL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskLevelCalculator {

    private final RiskProperties riskProperties;

    public RiskLevels calculate(RiskInput input) {
        InstrumentSpec instrument = riskProperties.instrument(input.symbolClass());
        double minDistance = minimumStopDistance(instrument, input.spread());
        List<String> reasons = new ArrayList<>();

        double stopDistance = Math.max(input.atr() * stopAtrMultiple(input) + input.spread(), minDistance);
        if (stopDistance == minDistance) {
            reasons.add(String.format(Locale.ROOT, "Stop widened to minimum distance %.1f pips", minDistance / instrument.pipSize()));
        }

        double targetDistance = switch (input.mode()) {
            case TREND -> rewardDistance(stopDistance, input.spread(), riskProperties.trendRewardRatio());
            case FALLBACK -> rewardDistance(stopDistance, input.spread(), riskProperties.fallbackRewardRatio());
            case RANGE -> rangeTargetDistance(input, reasons);
        };

        double sign = input.direction() == SignalDirection.BUY ? 1.0 : -1.0;
        double entry = input.entryPrice();
        double stopLoss = entry - (sign * stopDistance);
        double takeProfit = entry + (sign * targetDistance);

        return enforceDirection(input, stopLoss, takeProfit, minDistance, instrument, reasons);
    }

    /**
     * Repairs a stop or target sitting on the wrong side of entry and records why.
     */
    RiskLevels enforceDirection(
            RiskInput input,
            double stopLoss,
            double takeProfit,
            double minDistance,
            InstrumentSpec instrument,
            List<String> reasons
    ) {
        double entry = input.entryPrice();
        boolean buy = input.direction() == SignalDirection.BUY;
        double sign = buy ? 1.0 : -1.0;
        boolean corrected = false;

        boolean stopValid = buy ? stopLoss < entry : stopLoss > entry;
        if (!stopValid) {
            double distance = Math.max(input.atr() * riskProperties.correctionStopAtr(), minDistance);
            double repaired = entry - (sign * distance);
            log.warn("event=risk_correction field=stop_loss direction={} entry={} original={} corrected={}",
                    input.direction(), entry, stopLoss, repaired);
            reasons.add(String.format(Locale.ROOT, "Stop loss corrected from %.5f to %.5f", stopLoss, repaired));
            stopLoss = repaired;
            corrected = true;
        }

        boolean targetValid = buy ? takeProfit > entry : takeProfit < entry;
        if (!targetValid) {
            double repaired = entry + (sign * riskProperties.correctionRewardRatio() * Math.abs(entry - stopLoss));
            log.warn("event=risk_correction field=take_profit direction={} entry={} original={} corrected={}",
                    input.direction(), entry, takeProfit, repaired);
            reasons.add(String.format(Locale.ROOT, "Take profit corrected from %.5f to %.5f", takeProfit, repaired));
            takeProfit = repaired;
            corrected = true;
        }

        double stopDistance = Math.abs(entry - stopLoss);
        double targetDistance = Math.abs(takeProfit - entry);
        return new RiskLevels(
                entry,
                stopLoss,
                takeProfit,
                stopDistance > 0.0 ? targetDistance / stopDistance : 0.0,
                stopDistance / instrument.pipSize(),
                corrected,
                reasons
        );
    }

    public double minimumStopDistance(InstrumentSpec instrument, double spread) {
        return Math.max(instrument.minStopPips() * instrument.pipSize(), spread * riskProperties.spreadSafetyMultiplier());
    }

    private double stopAtrMultiple(RiskInput input) {
        return switch (input.mode()) {
            case TREND -> riskProperties.trendStopAtr();
            case RANGE -> riskProperties.rangeStopAtr();
            case FALLBACK -> riskProperties.fallbackStopAtr();
        };
    }

    /**
     * Reward ratio applied to the ATR part of the stop; the spread is added once.
     */
    private double rewardDistance(double stopDistance, double spread, double rewardRatio) {
        return (rewardRatio * (stopDistance - spread)) + spread;
    }

    private double rangeTargetDistance(RiskInput input, List<String> reasons) {
        double entry = input.entryPrice();
        boolean buy = input.direction() == SignalDirection.BUY;
        double cap = (input.atr() * riskProperties.rangeTargetCapAtr()) + input.spread();

        double meanReversion = input.meanReversionTarget();
        if (Double.isFinite(meanReversion) && (buy ? meanReversion > entry : meanReversion < entry)) {
            reasons.add(String.format(Locale.ROOT, "Target session VWAP %.5f", meanReversion));
            return Math.abs(meanReversion - entry);
        }

        double structural = buy ? input.structuralHigh() : input.structuralLow();
        if (Double.isFinite(structural) && (buy ? structural > entry : structural < entry)) {
            double distance = Math.min(Math.abs(structural - entry), cap);
            reasons.add(String.format(
                    Locale.ROOT,
                    "Target previous day %s %.5f%s",
                    buy ? "high" : "low",
                    structural,
                    distance < Math.abs(structural - entry) ? " (capped)" : ""
            ));
            return distance;
        }

        reasons.add(String.format(Locale.ROOT, "Target %.1f x ATR", riskProperties.rangeTargetCapAtr()));
        return cap;
    }
}
