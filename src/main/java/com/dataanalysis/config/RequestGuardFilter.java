package com.dataanalysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Front door for {@code /api/**}: tags every request with an id (echoed in the
 * response and exposed to the log pattern through MDC), then applies the
 * optional API-key check and per-client request budget.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestGuardFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestGuardFilter.class.getName() + ".requestId";
    static final String MDC_KEY = "requestId";

    private static final int MAX_TRACKED_CLIENTS = 10_000;

    @Value("${security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${security.api-key.header:X-API-Key}")
    private String apiKeyHeader;

    @Value("${security.api-key.values:}")
    private String apiKeyValues;

    @Value("${security.rate-limit.enabled:false}")
    private boolean rateLimitEnabled;

    @Value("${security.rate-limit.requests-per-minute:120}")
    private int requestsPerMinute;

    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, MinuteWindow> windows = new ConcurrentHashMap<>();

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_KEY, requestId);
        try {
            String apiKey = request.getHeader(apiKeyHeader);
            if (apiKeyEnabled && !acceptedKeys().contains(apiKey)) {
                reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized",
                       "Missing or invalid API key", request.getRequestURI(), requestId);
                return;
            }
            if (rateLimitEnabled && !withinBudget(clientKey(request, apiKey))) {
                reject(response, 429, "Too Many Requests",
                       "Rate limit of " + requestsPerMinute + " requests per minute exceeded",
                       request.getRequestURI(), requestId);
                return;
            }
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private Set<String> acceptedKeys() {
        return Arrays.stream(apiKeyValues.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .collect(Collectors.toSet());
    }

    private String clientKey(HttpServletRequest request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return "key:" + apiKey;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return "ip:" + forwardedFor.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private boolean withinBudget(String clientKey) {
        long minute = Instant.now().getEpochSecond() / 60;
        MinuteWindow window = windows.compute(clientKey, (key, existing) ->
                existing == null || existing.minute != minute ? new MinuteWindow(minute) : existing);
        int used = window.hits.incrementAndGet();
        if (windows.size() > MAX_TRACKED_CLIENTS) {
            windows.entrySet().removeIf(e -> e.getValue().minute < minute - 1);
        }
        return used <= requestsPerMinute;
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(REQUEST_ID_HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }

    private void reject(HttpServletResponse response, int status, String error, String message,
                        String path, String requestId) throws IOException {
        log.warn("Request rejected | status={} | path={} | reason={}", status, path, message);
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("error", error);
        body.put("message", message);
        body.put("path", path);
        body.put("requestId", requestId);
        body.put("timestamp", Instant.now().toString());
        objectMapper.writeValue(response.getWriter(), body);
    }

    private static final class MinuteWindow {
        private final long minute;
        private final AtomicInteger hits = new AtomicInteger();

        private MinuteWindow(long minute) {
            this.minute = minute;
        }
    }
}
