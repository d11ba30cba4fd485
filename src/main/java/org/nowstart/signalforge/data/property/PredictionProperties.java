package org.nowstart.signalforge.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.prediction")
public record PredictionProperties(
        // 외부 예측 서비스 호출 여부
        @DefaultValue("false") boolean enabled,
        // 외부 예측 서비스 기본 URL
        @NotBlank @DefaultValue("http://localhost:8000") String baseUrl,
        // 외부 예측 서비스 API Key(X-Api-Key 헤더)
        @DefaultValue("") String apiKey,
        // 연결 제한 시간
        @NotNull @DefaultValue("2s") Duration connectTimeout,
        // 응답 제한 시간
        @NotNull @DefaultValue("5s") Duration readTimeout
) {
}
