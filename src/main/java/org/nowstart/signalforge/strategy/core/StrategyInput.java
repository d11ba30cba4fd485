package org.nowstart.signalforge.strategy.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.signalforge.data.dto.PriceQuote;
import org.nowstart.signalforge.data.type.SymbolClass;
import org.nowstart.signalforge.data.type.Timeframe;

/**
 * @param symbol    normalized instrument symbol
 * @param candles   oldest-first candle history per timeframe
 * @param quote     current bid/ask, or null to price off the last primary close
 * @param asOf      evaluation time used for session and level resolution
 * @param params    strategy parameters
 */
public record StrategyInput<P extends StrategyParams>(
        String symbol,
        SymbolClass symbolClass,
        Map<Timeframe, List<OhlcvCandle>> candles,
        PriceQuote quote,
        Instant asOf,
        P params
) {

    public StrategyInput {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (asOf == null) {
            throw new IllegalArgumentException("asOf is required");
        }
        candles = candles == null ? Map.of() : Map.copyOf(candles);
    }

    public List<OhlcvCandle> candles(Timeframe timeframe) {
        return candles.getOrDefault(timeframe, List.of());
    }
}
