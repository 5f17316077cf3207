package com.calai.dietworkout.prediction.controller;

import com.calai.dietworkout.prediction.dto.PredictionResponse;
import com.calai.dietworkout.prediction.service.PredictionService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Prediction", description = "Daily kcal / weekly workout prediction + sample meal & workout plans")
@RequiredArgsConstructor
@RestController
public class PredictionController {

    private final PredictionService service;

    /** body 用 JsonNode 收：缺欄位要回第一個缺的 key，不能交給 data binding */
    @PostMapping(value = "/predict", produces = MediaType.APPLICATION_JSON_VALUE)
    public PredictionResponse predict(@RequestBody JsonNode body) {
        return service.predict(body);
    }
}
