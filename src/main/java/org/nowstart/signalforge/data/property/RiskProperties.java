package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.Positive;
import java.util.EnumMap;
import java.util.Map;
import org.nowstart.signalforge.data.type.SymbolClass;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.risk")
public record RiskProperties(
        // 심볼 분류별 pip 크기, 최소 손절 pip, 라운드넘버 간격
        Map<SymbolClass, InstrumentSpec> instruments,
        // 최소 손절 거리 산정 시 스프레드 배수
        @Positive @DefaultValue("1.5") double spreadSafetyMultiplier,
        // 추세 모드 손절 ATR 배수
        @Positive @DefaultValue("2.0") double trendStopAtr,
        // 횡보 모드 손절 ATR 배수
        @Positive @DefaultValue("1.5") double rangeStopAtr,
        // 폴백 모드 손절 ATR 배수
        @Positive @DefaultValue("2.5") double fallbackStopAtr,
        // 추세 모드 손익비
        @Positive @DefaultValue("2.0") double trendRewardRatio,
        // 폴백 모드 손익비
        @Positive @DefaultValue("1.5") double fallbackRewardRatio,
        // 횡보 모드 구조적 목표가 최대 거리(ATR 배수)
        @Positive @DefaultValue("2.5") double rangeTargetCapAtr,
        // 방향 보정 시 손절 ATR 배수
        @Positive @DefaultValue("2.0") double correctionStopAtr,
        // 방향 보정 시 손익비
        @Positive @DefaultValue("2.0") double correctionRewardRatio
) {

    public static final Map<SymbolClass, InstrumentSpec> DEFAULT_INSTRUMENTS = Map.of(
            SymbolClass.MAJOR_FX, new InstrumentSpec(0.0001, 15, 0.005),
            SymbolClass.JPY_QUOTED, new InstrumentSpec(0.01, 30, 0.5),
            SymbolClass.METAL, new InstrumentSpec(0.1, 50, 5.0),
            SymbolClass.CRYPTO, new InstrumentSpec(1.0, 100, 500.0)
    );

    public RiskProperties {
        Map<SymbolClass, InstrumentSpec> merged = new EnumMap<>(DEFAULT_INSTRUMENTS);
        if (instruments != null) {
            merged.putAll(instruments);
        }
        instruments = Map.copyOf(merged);
    }

    public static RiskProperties defaults() {
        return new RiskProperties(DEFAULT_INSTRUMENTS, 1.5, 2.0, 1.5, 2.5, 2.0, 1.5, 2.5, 2.0, 2.0);
    }

    public InstrumentSpec instrument(SymbolClass symbolClass) {
        return instruments.get(symbolClass);
    }

    public record InstrumentSpec(
            double pipSize,
            double minStopPips,
            double roundNumberStep
    ) {

        public InstrumentSpec {
            if (pipSize <= 0.0 || minStopPips <= 0.0 || roundNumberStep <= 0.0) {
                throw new IllegalArgumentException("instrument pipSize, minStopPips and roundNumberStep must be positive");
            }
        }
    }
}
