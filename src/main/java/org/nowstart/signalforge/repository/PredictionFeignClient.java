package org.nowstart.signalforge.repository;

import org.nowstart.signalforge.config.PredictionFeignConfig;
import org.nowstart.signalforge.data.dto.PredictionRequest;
import org.nowstart.signalforge.data.dto.PredictionResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "predictionClient",
        url = "${signalforge.prediction.base-url}",
        configuration = PredictionFeignConfig.class
)
public interface PredictionFeignClient {

    @PostMapping(value = "/predict", consumes = "application/json")
    PredictionResponse predict(@RequestBody PredictionRequest request);
}
