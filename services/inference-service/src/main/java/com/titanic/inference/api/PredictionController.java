package com.titanic.inference.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.titanic.inference.api.dto.PredictionResponse;
import com.titanic.inference.common.RequestContext;
import com.titanic.inference.common.RequestContextHolder;
import com.titanic.inference.features.PassengerFeatures;
import com.titanic.inference.prediction.EnsembleResult;
import com.titanic.inference.prediction.PredictionOrchestrator;
import com.titanic.inference.validation.InputValidator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PredictionController {
    private final InputValidator inputValidator;
    private final PredictionOrchestrator orchestrator;

    public PredictionController(InputValidator inputValidator, PredictionOrchestrator orchestrator) {
        this.inputValidator = inputValidator;
        this.orchestrator = orchestrator;
    }

    @PostMapping(path = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PredictionResponse predict(@RequestBody(required = false) JsonNode body) {
        PassengerFeatures features = inputValidator.validate(body);
        EnsembleResult result = orchestrator.predict(features);

        PredictionResponse response = PredictionResponse.from(result);
        RequestContext context = RequestContextHolder.get();
        if (context != null) {
            response.setTraceId(context.getTraceId());
            response.setRequestId(context.getRequestId());
        }
        return response;
    }
}
