package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.regime")
public record RegimeProperties(
        // ADX 계산 기간
        @Positive @DefaultValue("14") int adxPeriod,
        // Choppiness Index 계산 기간
        @Positive @DefaultValue("14") int choppinessPeriod,
        // 추세 판정 ADX 하한(초과)
        @Positive @DefaultValue("25") double adxTrendThreshold,
        // 추세 판정 Choppiness 상한(미만)
        @Positive @DefaultValue("50") double choppinessTrendCeiling,
        // 횡보 판정 Choppiness 하한(초과)
        @Positive @DefaultValue("61.8") double choppinessRangeThreshold
) {

    public RegimeProperties {
        if (choppinessTrendCeiling > choppinessRangeThreshold) {
            throw new IllegalArgumentException("choppinessTrendCeiling must not exceed choppinessRangeThreshold");
        }
    }

    public static RegimeProperties defaults() {
        return new RegimeProperties(14, 14, 25.0, 50.0, 61.8);
    }
}
