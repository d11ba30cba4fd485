package org.nowstart.signalforge.service.prediction;

import feign.FeignException;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.ExternalPrediction;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.PredictionFeatures;
import org.nowstart.signalforge.data.dto.PredictionRequest;
import org.nowstart.signalforge.data.dto.PredictionResponse;
import org.nowstart.signalforge.data.property.PredictionProperties;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.repository.PredictionFeignClient;
import org.springframework.stereotype.Service;

/**
 * Fetches a model prediction when the caller did not supply one. Any failure yields empty so the
 * technical fallback takes over; calls are never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExternalPredictionService {

    private final PredictionFeignClient predictionFeignClient;
    private final PredictionProperties predictionProperties;

    public Optional<ExternalPrediction> fetch(String symbol, IndicatorSet indicators, double price) {
        if (!predictionProperties.enabled()) {
            return Optional.empty();
        }
        try {
            PredictionResponse response = predictionFeignClient.predict(
                    new PredictionRequest(symbol, PredictionFeatures.from(indicators, price))
            );
            return toPrediction(symbol, response);
        } catch (FeignException e) {
            log.warn("event=prediction_unavailable symbol={} status={} message={}", symbol, e.status(), e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("event=prediction_invalid symbol={} message={}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ExternalPrediction> toPrediction(String symbol, PredictionResponse response) {
        if (response == null || response.prediction() == null || response.confidence() == null) {
            log.warn("event=prediction_invalid symbol={} message=empty response", symbol);
            return Optional.empty();
        }
        SignalDirection direction = SignalDirection.valueOf(response.prediction().trim().toUpperCase(Locale.ROOT));
        double confidence = response.confidence();
        if (!(confidence >= 0.0 && confidence <= 100.0)) {
            throw new IllegalArgumentException("prediction confidence out of range: " + confidence);
        }
        boolean modelAvailable = Boolean.TRUE.equals(response.model_available());
        log.info("event=prediction_received symbol={} direction={} confidence={} model_available={}",
                symbol, direction, confidence, modelAvailable);
        return Optional.of(new ExternalPrediction(direction, confidence, modelAvailable));
    }
}
