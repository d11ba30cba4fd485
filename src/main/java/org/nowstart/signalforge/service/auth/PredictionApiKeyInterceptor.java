package org.nowstart.signalforge.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class PredictionApiKeyInterceptor implements RequestInterceptor {

    static final String API_KEY_HEADER = "X-Api-Key";

    private final String apiKey;

    @Override
    public void apply(RequestTemplate template) {
        if (apiKey != null && !apiKey.isBlank()) {
            template.header(API_KEY_HEADER, apiKey);
        }
        template.header("Accept", "application/json");
        template.header("User-Agent", "signalforge/1.0");
    }
}
