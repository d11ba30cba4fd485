package org.nowstart.signalforge.service.indicator;

import java.util.List;
import org.nowstart.signalforge.data.dto.ChoppinessReading;
import org.nowstart.signalforge.data.exception.InsufficientDataException;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

/**
 * Pure indicator functions over oldest-first series. Every method returns the value at the last sample.
 */
@Service
public class IndicatorComputationService {

    public static final double NEUTRAL_CHOPPINESS = 50.0;
    public static final double FLAT_RANGE_CHOPPINESS = 100.0;

    public double simpleMovingAverage(double[] values, int period) {
        requirePeriod(period);
        requireSamples("SMA(" + period + ")", period, values.length);

        double total = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            total += values[i];
        }
        return total / period;
    }

    /**
     * EMA seeded with the first sample, smoothing factor {@code 2 / (period + 1)}.
     */
    public double exponentialMovingAverage(double[] values, int period) {
        requirePeriod(period);
        requireSamples("EMA(" + period + ")", period, values.length);

        double alpha = 2.0 / (period + 1.0);
        double ema = values[0];
        for (int i = 1; i < values.length; i++) {
            ema = (alpha * values[i]) + ((1.0 - alpha) * ema);
        }
        return ema;
    }

    /**
     * Average gain over average loss of the last {@code period} deltas. A window without losses reads 100.
     */
    public double relativeStrengthIndex(double[] closes, int period) {
        requirePeriod(period);
        requireSamples("RSI(" + period + ")", period + 1, closes.length);

        double gains = 0.0;
        double losses = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                gains += change;
            } else {
                losses -= change;
            }
        }

        double avgGain = gains / period;
        double avgLoss = losses / period;
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * Mean of the last {@code period} true ranges.
     */
    public double averageTrueRange(List<OhlcvCandle> candles, int period) {
        requirePeriod(period);
        requireSamples("ATR(" + period + ")", period + 1, candles.size());

        double total = 0.0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            total += trueRange(candles.get(i), candles.get(i - 1));
        }
        return total / period;
    }

    /**
     * Wilder ADX. Returns 0 with fewer than {@code period + 1} candles, and the latest DX while the DX
     * series is still shorter than {@code period}.
     */
    public double averageDirectionalIndex(List<OhlcvCandle> candles, int period) {
        requirePeriod(period);
        int n = candles.size();
        if (n < period + 1) {
            return 0.0;
        }

        double smoothedTr = 0.0;
        double smoothedPlusDm = 0.0;
        double smoothedMinusDm = 0.0;
        double adx = 0.0;
        double dxTotal = 0.0;
        int dxCount = 0;
        double latestDx = 0.0;

        for (int i = 1; i < n; i++) {
            OhlcvCandle current = candles.get(i);
            OhlcvCandle previous = candles.get(i - 1);
            double upMove = current.high() - previous.high();
            double downMove = previous.low() - current.low();
            double plusDm = upMove > downMove && upMove > 0 ? upMove : 0.0;
            double minusDm = downMove > upMove && downMove > 0 ? downMove : 0.0;
            double tr = trueRange(current, previous);

            if (i <= period) {
                smoothedTr += tr;
                smoothedPlusDm += plusDm;
                smoothedMinusDm += minusDm;
                if (i < period) {
                    continue;
                }
            } else {
                smoothedTr = smoothedTr - (smoothedTr / period) + tr;
                smoothedPlusDm = smoothedPlusDm - (smoothedPlusDm / period) + plusDm;
                smoothedMinusDm = smoothedMinusDm - (smoothedMinusDm / period) + minusDm;
            }

            latestDx = directionalIndex(smoothedTr, smoothedPlusDm, smoothedMinusDm);
            dxCount++;
            if (dxCount < period) {
                dxTotal += latestDx;
            } else if (dxCount == period) {
                adx = (dxTotal + latestDx) / period;
            } else {
                adx = ((adx * (period - 1)) + latestDx) / period;
            }
        }

        return dxCount >= period ? adx : latestDx;
    }

    /**
     * Choppiness index of the last {@code period} candles. Returns the neutral 50 when the window is
     * incomplete and a degenerate 100 when the window has no range.
     */
    public ChoppinessReading choppinessIndex(List<OhlcvCandle> candles, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("choppiness period must be >= 2");
        }
        int n = candles.size();
        if (n < period) {
            return new ChoppinessReading(NEUTRAL_CHOPPINESS, false);
        }

        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        double trSum = 0.0;
        for (int i = n - period; i < n; i++) {
            OhlcvCandle candle = candles.get(i);
            highest = Math.max(highest, candle.high());
            lowest = Math.min(lowest, candle.low());
            trSum += i == 0 ? candle.high() - candle.low() : trueRange(candle, candles.get(i - 1));
        }

        double range = highest - lowest;
        if (range <= 0.0 || trSum <= 0.0) {
            return new ChoppinessReading(FLAT_RANGE_CHOPPINESS, true);
        }

        double chop = 100.0 * Math.log10(trSum / range) / Math.log10(period);
        return new ChoppinessReading(Math.max(0.0, Math.min(100.0, chop)), false);
    }

    /**
     * Volume-weighted typical price. Zero-volume candles count with weight 1.
     */
    public double volumeWeightedAveragePrice(List<OhlcvCandle> candles) {
        requireSamples("VWAP", 1, candles.size());

        double weightedTotal = 0.0;
        double volumeTotal = 0.0;
        for (OhlcvCandle candle : candles) {
            double volume = candle.volume() > 0.0 ? candle.volume() : 1.0;
            weightedTotal += candle.typicalPrice() * volume;
            volumeTotal += volume;
        }
        return weightedTotal / volumeTotal;
    }

    public double[] closes(List<OhlcvCandle> candles) {
        double[] closes = new double[candles.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = candles.get(i).close();
        }
        return closes;
    }

    private double trueRange(OhlcvCandle current, OhlcvCandle previous) {
        double highLow = current.high() - current.low();
        double highPrevClose = Math.abs(current.high() - previous.close());
        double lowPrevClose = Math.abs(current.low() - previous.close());
        return Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
    }

    private double directionalIndex(double smoothedTr, double smoothedPlusDm, double smoothedMinusDm) {
        if (smoothedTr <= 0.0) {
            return 0.0;
        }
        double plusDi = 100.0 * smoothedPlusDm / smoothedTr;
        double minusDi = 100.0 * smoothedMinusDm / smoothedTr;
        double diSum = plusDi + minusDi;
        if (diSum == 0.0) {
            return 0.0;
        }
        return 100.0 * Math.abs(plusDi - minusDi) / diSum;
    }

    private void requirePeriod(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive");
        }
    }

    private void requireSamples(String indicator, int required, int actual) {
        if (actual < required) {
            throw new InsufficientDataException(indicator, required, actual);
        }
    }
}
