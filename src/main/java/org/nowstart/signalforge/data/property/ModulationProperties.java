package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.modulation")
public record ModulationProperties(
        // 가중치 구성 요소별 비중(합계 1.0)
        @NotNull @DefaultValue Weights weights,
        // 보정 결과가 없을 때 사용할 신뢰도 임계값
        @Positive @DefaultValue("60") double defaultThreshold,
        // 시그널 신뢰도 하한
        @Positive @DefaultValue("40") double minSignalConfidence,
        // 시그널 신뢰도 상한
        @Positive @DefaultValue("95") double maxSignalConfidence,
        // 외부 예측이 방향을 뒤집기 위한 50 기준 최소 편차
        @Positive @DefaultValue("25") double predictionOverrideDistance,
        // 기술적 폴백 신뢰도 하한
        @Positive @DefaultValue("45") double technicalFallbackFloor,
        // 기술적 폴백 신뢰도 상한
        @Positive @DefaultValue("85") double technicalFallbackCeiling,
        // 변동성이 안정적인 심볼 목록
        @NotNull @DefaultValue({"EURUSD", "USDCAD"}) List<String> stableSymbols,
        // 변동성이 큰 심볼 목록
        @NotNull @DefaultValue({"XAUUSD", "GBPUSD"}) List<String> volatileSymbols
) {

    public ModulationProperties {
        if (minSignalConfidence > maxSignalConfidence) {
            throw new IllegalArgumentException("minSignalConfidence must not exceed maxSignalConfidence");
        }
        if (technicalFallbackFloor > technicalFallbackCeiling) {
            throw new IllegalArgumentException("technicalFallbackFloor must not exceed technicalFallbackCeiling");
        }
        stableSymbols = List.copyOf(stableSymbols);
        volatileSymbols = List.copyOf(volatileSymbols);
    }

    public static ModulationProperties defaults() {
        return new ModulationProperties(
                Weights.defaults(),
                60.0,
                40.0,
                95.0,
                25.0,
                45.0,
                85.0,
                List.of("EURUSD", "USDCAD"),
                List.of("XAUUSD", "GBPUSD")
        );
    }

    public record Weights(
            @DefaultValue("0.30") double mlConfidence,
            @DefaultValue("0.25") double technicalQuality,
            @DefaultValue("0.20") double marketConditions,
            @DefaultValue("0.15") double mtfConfirmation,
            @DefaultValue("0.10") double riskFactors
    ) {

        public Weights {
            double sum = mlConfidence + technicalQuality + marketConditions + mtfConfirmation + riskFactors;
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalArgumentException("modulation weights must sum to 1.0 but was " + sum);
            }
        }

        public static Weights defaults() {
            return new Weights(0.30, 0.25, 0.20, 0.15, 0.10);
        }
    }
}
