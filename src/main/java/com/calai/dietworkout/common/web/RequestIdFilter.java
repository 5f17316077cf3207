package com.calai.dietworkout.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * API 請求的 request id + 一行 access log：
 * - client 帶的 X-Request-Id 只收安全字元（最多 64），否則自己產 UUID，避免把亂碼寫進 log
 * - actuator / swagger 不綁 id、不記 log（health check 很吵）
 * - 錯誤回應的 requestId 由 {@link #resolve} 取，跟 header 一致
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = RequestIdFilter.class.getName() + ".rid";
    public static final String MDC_KEY = "rid";

    static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    static final List<String> SKIP_PREFIXES = List.of("/actuator", "/swagger-ui", "/v3/api-docs");

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        String path = req.getRequestURI().substring(req.getContextPath().length());
        return SKIP_PREFIXES.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = accept(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        long start = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            log.info("{} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), res.getStatus(),
                    (System.nanoTime() - start) / 1_000_000);
            MDC.remove(MDC_KEY);
        }
    }

    /** 已綁定就回綁定的 id；沒經過 filter（被略過的路徑）就臨時產一個 */
    public static String resolve(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    static String accept(String inbound) {
        if (inbound != null && SAFE_ID.matcher(inbound).matches()) return inbound;
        return UUID.randomUUID().toString();
    }
}
