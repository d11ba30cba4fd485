package org.nowstart.signalforge.config;

import feign.Request;
import feign.RequestInterceptor;
import java.util.concurrent.TimeUnit;
import org.nowstart.signalforge.data.property.PredictionProperties;
import org.nowstart.signalforge.service.auth.PredictionApiKeyInterceptor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PredictionFeignConfig {

    @Bean
    @RefreshScope
    public RequestInterceptor predictionApiKeyInterceptor(PredictionProperties predictionProperties) {
        return new PredictionApiKeyInterceptor(predictionProperties.apiKey());
    }

    @Bean
    public Request.Options predictionRequestOptions(PredictionProperties predictionProperties) {
        return new Request.Options(
                predictionProperties.connectTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                predictionProperties.readTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                true
        );
    }
}
