package com.calai.dietworkout.common.web;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全站兜底：
 * - 400：request body 不是合法 JSON
 * - 4xx：MVC 自己的路由錯誤（404 無此路徑 / 405 方法不對 / 415 Content-Type 不對）維持原狀態碼
 * - 500：IllegalStateException（帶 code，例如 NON_NUMERIC_PARAMETER）
 * - 500：其他未預期錯誤
 * 缺必要欄位由 prediction 模組自己的 advice 處理（優先序較高）。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest req) {
        log.info("malformed_json {} {}", req.getMethod(), req.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("MALFORMED_JSON", null, RequestIdFilter.resolve(req)));
    }

    // ===== 4xx from Spring MVC (NoResourceFound / MethodNotSupported / MediaTypeNotSupported ...) =====

    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<Map<String, Object>> handleFramework(Exception ex, HttpServletRequest req) {
        if (!(ex instanceof ErrorResponse er)) return handleUnknown(ex, req);

        HttpStatusCode status = er.getStatusCode();
        if (status.is5xxServerError()) return handleUnknown(ex, req);

        String rid = RequestIdFilter.resolve(req);
        log.info("RID={} {} {} rejected status={}", rid, req.getMethod(), req.getRequestURI(), status.value());
        return ResponseEntity.status(status)
                .headers(er.getHeaders()) // 405 要帶 Allow
                .body(err(statusCode(status), ex.getMessage(), rid));
    }

    // ===== 500 from IllegalStateException codes =====

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex,
                                                                  HttpServletRequest req) {
        String code = (ex.getMessage() == null || ex.getMessage().isBlank())
                ? "ILLEGAL_STATE"
                : codeOf(ex.getMessage());

        String rid = RequestIdFilter.resolve(req);
        log.error("RID={} {} {} failed code={}", rid, req.getMethod(), req.getRequestURI(), code, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err(code, ex.getMessage(), rid));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        String rid = RequestIdFilter.resolve(req);
        log.error("RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage(), rid));
    }

    private static String statusCode(HttpStatusCode status) {
        HttpStatus s = HttpStatus.resolve(status.value());
        return s == null ? "HTTP_" + status.value() : s.name();
    }

    /** "NON_NUMERIC_PARAMETER: age" -> "NON_NUMERIC_PARAMETER" */
    private static String codeOf(String message) {
        String m = message.trim();
        int idx = m.indexOf(':');
        return idx > 0 ? m.substring(0, idx).trim() : m;
    }

    private static Map<String, Object> err(String code, String message, String requestId) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", requestId);
        return m;
    }
}
