package org.nowstart.signalforge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.signalforge.data.dto.CandleDto;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.data.dto.SignalRequest;
import org.nowstart.signalforge.data.property.ModulationProperties;
import org.nowstart.signalforge.data.property.PredictionProperties;
import org.nowstart.signalforge.data.property.RegimeProperties;
import org.nowstart.signalforge.data.property.RiskProperties;
import org.nowstart.signalforge.data.property.SessionProperties;
import org.nowstart.signalforge.data.property.SignalEngineProperties;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.repository.CalibrationRecordRepository;
import org.nowstart.signalforge.repository.PredictionFeignClient;
import org.nowstart.signalforge.service.calibration.CalibrationRecordHolder;
import org.nowstart.signalforge.service.indicator.IndicatorComputationService;
import org.nowstart.signalforge.service.level.SessionLevelCalculator;
import org.nowstart.signalforge.service.modulation.ConfidenceModulationService;
import org.nowstart.signalforge.service.modulation.SentimentOverlayService;
import org.nowstart.signalforge.service.modulation.SignalWeightCalculator;
import org.nowstart.signalforge.service.modulation.TechnicalConfidenceCalculator;
import org.nowstart.signalforge.service.prediction.ExternalPredictionService;
import org.nowstart.signalforge.service.regime.MarketRegimeClassifier;
import org.nowstart.signalforge.service.risk.RiskLevelCalculator;
import org.nowstart.signalforge.strategy.StrategyParamResolver;
import org.nowstart.signalforge.strategy.StrategyRegistry;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyParams;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategySelector;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.nowstart.signalforge.support.Candles;

/**
 * Runs requests through the real engine, modulation and risk placement; only persistence and the
 * outbound prediction client are mocked.
 */
@ExtendWith(MockitoExtension.class)
class SignalPipelineTest {

    private static final Instant AS_OF = Instant.parse("2026-01-05T14:00:00Z");

    @Mock
    private PredictionFeignClient predictionFeignClient;
    @Mock
    private CalibrationRecordRepository calibrationRecordRepository;

    private SignalGenerationService service;

    @BeforeEach
    void setUp() {
        RegimeProperties regimeProperties = RegimeProperties.defaults();
        RiskProperties riskProperties = RiskProperties.defaults();
        ModulationProperties modulationProperties = ModulationProperties.defaults();

        AdaptiveStrategyEngine engine = new AdaptiveStrategyEngine(
                new IndicatorComputationService(),
                new MarketRegimeClassifier(regimeProperties),
                new SessionLevelCalculator(SessionProperties.defaults(), riskProperties),
                new AdaptiveStrategySelector(),
                regimeProperties
        );
        StrategyRegistry registry = new StrategyRegistry(List.of(engine));
        registry.init();

        service = new SignalGenerationService(
                new StrategyParamResolver(new SignalEngineProperties(AdaptiveStrategyEngine.VERSION), List.of(AdaptiveStrategyParams.defaults())),
                registry,
                new ExternalPredictionService(predictionFeignClient, new PredictionProperties(
                        false, "http://localhost:8000", "", Duration.ofSeconds(2), Duration.ofSeconds(3)
                )),
                new ConfidenceModulationService(
                        modulationProperties,
                        new TechnicalConfidenceCalculator(modulationProperties),
                        new SignalWeightCalculator(modulationProperties),
                        new SentimentOverlayService(),
                        new CalibrationRecordHolder(calibrationRecordRepository)
                ),
                new RiskLevelCalculator(riskProperties),
                new SignalLogService(),
                Clock.fixed(AS_OF, ZoneOffset.UTC)
        );
    }

    @Test
    void generate_risingMarketPlacesBuyLevelsAroundEntry() {
        SignalRecord record = service.generate(request(risingCandles()));

        assertThat(record.direction()).isEqualTo(SignalDirection.BUY);
        assertThat(record.stopLoss()).isLessThan(record.entryPrice());
        assertThat(record.takeProfit()).isGreaterThan(record.entryPrice());
        assertThat(record.confidence()).isBetween(0.0, 100.0);
        assertThat(record.finalIntensity()).isBetween(0.1, 2.0);
        verifyNoInteractions(predictionFeignClient);
    }

    @Test
    void generate_fallingMarketPlacesSellLevelsAroundEntry() {
        SignalRecord record = service.generate(request(fallingCandles()));

        assertThat(record.direction()).isEqualTo(SignalDirection.SELL);
        assertThat(record.takeProfit()).isLessThan(record.entryPrice());
        assertThat(record.stopLoss()).isGreaterThan(record.entryPrice());
        assertThat(record.confidence()).isBetween(0.0, 100.0);
        assertThat(record.finalIntensity()).isBetween(0.1, 2.0);
    }

    @Test
    void generate_identicalRequestsProduceEqualRecords() {
        for (Map<Timeframe, List<OhlcvCandle>> candles : List.of(risingCandles(), fallingCandles())) {
            SignalRequest request = request(candles);

            SignalRecord first = service.generate(request);
            SignalRecord second = service.generate(request);

            assertThat(second).isEqualTo(first);
            assertThat(second.reasons()).containsExactlyElementsOf(first.reasons());
            assertThat(second.diagnostics()).containsExactlyEntriesOf(first.diagnostics());
        }
    }

    private SignalRequest request(Map<Timeframe, List<OhlcvCandle>> candles) {
        Map<Timeframe, List<CandleDto>> dtos = new EnumMap<>(Timeframe.class);
        candles.forEach((timeframe, items) -> dtos.put(timeframe, items.stream()
                .map(candle -> new CandleDto(candle.timestamp(), candle.open(), candle.high(), candle.low(), candle.close(), candle.volume()))
                .toList()));
        return new SignalRequest("EUR/USD", dtos, null, AS_OF, null, null, null, null);
    }

    private Map<Timeframe, List<OhlcvCandle>> risingCandles() {
        return Map.of(
                Timeframe.M5, Candles.rising(Instant.parse("2026-01-05T09:00:00Z"), Duration.ofMinutes(5), 60, 1.0800, 0.0001),
                Timeframe.M15, Candles.rising(Instant.parse("2026-01-04T23:00:00Z"), Duration.ofMinutes(15), 60, 1.0790, 0.0001),
                Timeframe.H1, Candles.rising(Instant.parse("2026-01-04T00:00:00Z"), Duration.ofHours(1), 30, 1.0700, 0.0005)
        );
    }

    private Map<Timeframe, List<OhlcvCandle>> fallingCandles() {
        return Map.of(
                Timeframe.M5, falling(Instant.parse("2026-01-05T09:00:00Z"), Duration.ofMinutes(5), 60, 1.0900, 0.0001),
                Timeframe.M15, falling(Instant.parse("2026-01-04T23:00:00Z"), Duration.ofMinutes(15), 60, 1.0910, 0.0001),
                Timeframe.H1, falling(Instant.parse("2026-01-04T00:00:00Z"), Duration.ofHours(1), 30, 1.1000, 0.0005)
        );
    }

    private List<OhlcvCandle> falling(Instant start, Duration interval, int count, double base, double step) {
        List<OhlcvCandle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double close = base - (i * step);
            candles.add(new OhlcvCandle(start.plus(interval.multipliedBy(i)), close + step, close + step, close - step, close, 1000));
        }
        return candles;
    }
}
