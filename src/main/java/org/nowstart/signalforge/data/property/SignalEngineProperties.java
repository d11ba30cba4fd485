package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.engine")
public record SignalEngineProperties(
        // 시그널 생성에 사용할 전략 버전
        @NotBlank @DefaultValue("adaptive-v1") String activeStrategyVersion
) {
}
