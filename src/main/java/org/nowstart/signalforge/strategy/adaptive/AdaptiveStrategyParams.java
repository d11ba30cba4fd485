package org.nowstart.signalforge.strategy.adaptive;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.strategy.core.VersionedStrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.strategy.adaptive")
public record AdaptiveStrategyParams(
        // 진입 판단 기준 타임프레임
        @NotNull @DefaultValue("M5") Timeframe primaryTimeframe,
        // 구조(EMA50, ATR) 확인용 타임프레임
        @NotNull @DefaultValue("M15") Timeframe structureTimeframe,
        // 상위 추세 확인용 타임프레임
        @NotNull @DefaultValue("H1") Timeframe higherTimeframe,
        // 단기 EMA 길이
        @Positive @DefaultValue("12") int emaFastLength,
        // 중기 EMA 길이
        @Positive @DefaultValue("21") int emaSlowLength,
        // 눌림목 판정 EMA 길이(구조 타임프레임)
        @Positive @DefaultValue("50") int emaMidLength,
        // 타임프레임 추세 판정 EMA 길이
        @Positive @DefaultValue("20") int trendEmaLength,
        // RSI 기간
        @Positive @DefaultValue("14") int rsiPeriod,
        // ATR 기간(구조 타임프레임)
        @Positive @DefaultValue("14") int atrPeriod,
        // 당일 캔들이 없을 때 VWAP 계산에 사용할 최근 캔들 수
        @Positive @DefaultValue("50") int vwapFallbackCandles,
        // 추세 모드 기본 신뢰도
        @Positive @DefaultValue("60") double trendBaseConfidence,
        // 횡보 모드 기본 신뢰도
        @Positive @DefaultValue("55") double rangeBaseConfidence,
        // 모멘텀 폴백 신뢰도
        @Positive @DefaultValue("45") double momentumFallbackConfidence,
        // 멀티 타임프레임 폴백 신뢰도(폴백 하한)
        @Positive @DefaultValue("40") double alignmentFallbackConfidence,
        // 추세 매수 RSI 하한/상한
        @Positive @DefaultValue("45") double trendBuyRsiFloor,
        @Positive @DefaultValue("70") double trendBuyRsiCeiling,
        // 추세 매도 RSI 하한/상한
        @Positive @DefaultValue("30") double trendSellRsiFloor,
        @Positive @DefaultValue("55") double trendSellRsiCeiling,
        // 횡보 매수 RSI 상한(과매도)
        @Positive @DefaultValue("35") double rangeBuyRsiCeiling,
        // 횡보 매도 RSI 하한(과매수)
        @Positive @DefaultValue("65") double rangeSellRsiFloor,
        // 추세 진입 최소 ATR%
        @Positive @DefaultValue("0.05") double trendMinAtrPercent,
        // 횡보 진입 최소 ATR%
        @Positive @DefaultValue("0.03") double rangeMinAtrPercent,
        // 저변동성 감점 기준 ATR%
        @Positive @DefaultValue("0.08") double lowVolatilityAtrPercent
) implements VersionedStrategyParams {

    public AdaptiveStrategyParams {
        if (emaFastLength >= emaSlowLength) {
            throw new IllegalArgumentException("emaFastLength must be shorter than emaSlowLength");
        }
        if (trendBuyRsiFloor >= trendBuyRsiCeiling || trendSellRsiFloor >= trendSellRsiCeiling) {
            throw new IllegalArgumentException("trend RSI floor must be below ceiling");
        }
        if (alignmentFallbackConfidence > momentumFallbackConfidence) {
            throw new IllegalArgumentException("alignmentFallbackConfidence must not exceed momentumFallbackConfidence");
        }
    }

    public static AdaptiveStrategyParams defaults() {
        return new AdaptiveStrategyParams(
                Timeframe.M5, Timeframe.M15, Timeframe.H1,
                12, 21, 50, 20, 14, 14, 50,
                60.0, 55.0, 45.0, 40.0,
                45.0, 70.0, 30.0, 55.0,
                35.0, 65.0,
                0.05, 0.03, 0.08
        );
    }

    @Override
    public String version() {
        return AdaptiveStrategyEngine.VERSION;
    }
}
