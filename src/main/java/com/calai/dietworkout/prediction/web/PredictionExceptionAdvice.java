package com.calai.dietworkout.prediction.web;

import com.calai.dietworkout.prediction.dto.MissingParameterResponse;
import com.calai.dietworkout.prediction.exception.MissingParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * ✅ prediction 專屬：只處理「缺必要欄位」。
 * 其他錯誤交給全站 ApiExceptionHandler，所以這裡要排在它前面。
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "com.calai.dietworkout.prediction")
public class PredictionExceptionAdvice {

    @ExceptionHandler(MissingParameterException.class)
    public ResponseEntity<MissingParameterResponse> handleMissing(MissingParameterException e) {
        log.info("predict_missing_parameter field={}", e.getField());
        return ResponseEntity.badRequest().body(new MissingParameterResponse(e.getMessage()));
    }
}
