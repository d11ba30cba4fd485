package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.calibration")
public record CalibrationProperties(
        // 보정에 사용할 과거 라벨링 시그널 조회 기간
        @NotNull @DefaultValue("90d") Duration window,
        // 평가할 신뢰도 임계값 후보
        @NotEmpty @DefaultValue({"50", "55", "60", "65", "70", "75", "80", "85", "90", "95"}) List<Integer> thresholds,
        // 보정 실행에 필요한 최소 라벨링 시그널 수
        @Positive @DefaultValue("100") int minSamples,
        // 임계값 하나를 평가하기 위한 최소 통과 시그널 수
        @Positive @DefaultValue("10") int minQualifiedSignals,
        // 점수 산정 시 승률 비중
        @Positive @DefaultValue("0.6") double winRateWeight,
        // 점수 산정 시 평균 pip 비중
        @Positive @DefaultValue("0.4") double avgPipsWeight,
        // 과거 시그널 조회 제한 시간
        @NotNull @DefaultValue("30s") Duration fetchTimeout,
        // 보정 스케줄(cron, 기본 매월 1일 03:00)
        @NotBlank @DefaultValue("0 0 3 1 * *") String cron
) {

    public CalibrationProperties {
        thresholds = thresholds.stream().sorted().distinct().toList();
    }

    public static CalibrationProperties defaults() {
        return new CalibrationProperties(
                Duration.ofDays(90),
                List.of(50, 55, 60, 65, 70, 75, 80, 85, 90, 95),
                100,
                10,
                0.6,
                0.4,
                Duration.ofSeconds(30),
                "0 0 3 1 * *"
        );
    }
}
