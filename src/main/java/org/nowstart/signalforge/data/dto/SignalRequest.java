package org.nowstart.signalforge.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.signalforge.data.type.Timeframe;

public record SignalRequest(
        @NotBlank String symbol,
        @NotEmpty Map<Timeframe, List<@Valid CandleDto>> candles,
        @Valid PriceQuote quote,
        Instant asOf,
        @Valid ExternalPrediction prediction,
        SentimentAssessment sentiment,
        List<@Valid TimeframeSignal> timeframeSignals,
        RiskMetrics riskMetrics
) {
}
