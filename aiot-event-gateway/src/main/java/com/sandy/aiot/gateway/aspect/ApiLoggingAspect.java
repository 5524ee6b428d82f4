package com.sandy.aiot.gateway.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.vo.DiagnosticReport;
import com.sandy.aiot.gateway.vo.DiagnosticRequest;
import com.sandy.aiot.gateway.vo.EventPage;
import com.sandy.aiot.gateway.vo.GapAnalysis;
import com.sandy.aiot.gateway.vo.PatternDetectionResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One request line and one outcome line per gateway API call.
 * <p>
 * Webhook bodies are logged by size with a flag for the signature header, never their content.
 * Event pages, gap analyses, detection results and diagnostic reports are logged as counts.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_LOGGED_CHARS = 500;

    private final ObjectMapper objectMapper;

    @Value("${gateway.webhook.signature-header:X-ST-HMAC}")
    private String signatureHeader = "X-ST-HMAC";
    @Value("${gateway.api.slow-request-ms:2000}")
    private long slowRequestMs = 2000;

    @Around("within(com.sandy.aiot.gateway.controller..*) && !within(com.sandy.aiot.gateway.controller.ApiExceptionHandler)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String route = request != null ? request.getMethod() + " " + request.getRequestURI() : pjp.getSignature().toShortString();

        log.info("API Request: route={} {}", route, describeRequest(request, pjp.getArgs()));

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error != null) {
                log.error("API Error: route={} durationMs={} errorType={} message={}", route, cost, error.getClass().getSimpleName(), error.getMessage());
            } else if (cost > slowRequestMs) {
                log.warn("API Slow response: route={} durationMs={} slowRequestMs={} {}", route, cost, slowRequestMs, describe(result));
            } else {
                log.info("API Response: route={} durationMs={} {}", route, cost, describe(result));
            }
        }
    }

    String describeRequest(HttpServletRequest request, Object[] args) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (request != null) {
            Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
            if (vars instanceof Map<?, ?> pathVars) {
                pathVars.forEach((k, v) -> fields.put(String.valueOf(k), v));
            }
            if (request.getQueryString() != null) fields.put("query", request.getQueryString());
        }
        for (Object a : args) {
            if (a instanceof byte[] body) {
                fields.put("bodyBytes", body.length);
                fields.put("signed", request != null && request.getHeader(signatureHeader) != null);
            } else if (a instanceof DiagnosticRequest dr) {
                fields.put("intent", dr.getIntent());
                if (dr.getDevice() != null) fields.put("device", dr.getDevice());
            }
        }
        return keyValues(fields);
    }

    /** Compact outcome: counts for the gateway's large responses, truncated JSON otherwise. */
    String describe(Object result) {
        if (result instanceof ResponseEntity<?> re) {
            return "status=" + re.getStatusCode().value() + " " + describe(re.getBody());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        if (result instanceof SseEmitter) {
            fields.put("result", "<event stream>");
        } else if (result instanceof EventPage page) {
            fields.put("deviceId", page.getDeviceId());
            fields.put("events", page.getCount());
            fields.put("totalCount", page.getTotalCount());
            fields.put("gaps", page.getGaps() == null ? 0 : page.getGaps().size());
        } else if (result instanceof GapAnalysis gaps) {
            fields.put("gaps", gaps.getGaps().size());
            fields.put("suspiciousGaps", gaps.getSuspiciousGaps().size());
            fields.put("thresholdMs", gaps.getThresholdMs());
        } else if (result instanceof PatternDetectionResult pd) {
            fields.put("deviceId", pd.getDeviceId());
            fields.put("eventsAnalyzed", pd.getEventsAnalyzed());
            fields.put("patterns", pd.getPatterns().stream().map(p -> p.getType() + "/" + p.getSeverity()).toList());
            if (!pd.getErrors().isEmpty()) fields.put("errors", pd.getErrors());
        } else if (result instanceof DiagnosticReport report) {
            fields.put("recommendations", report.getRecommendations().size());
            fields.put("unavailableSources", report.getUnavailableSources());
            fields.put("elapsedMs", report.getElapsedMs());
        } else if (result instanceof QueueJob job) {
            fields.put("jobId", job.getId());
            fields.put("jobStatus", job.getStatus());
        } else if (result instanceof Collection<?> c) {
            fields.put("items", c.size());
        } else {
            fields.put("body", toJson(result));
        }
        return keyValues(fields);
    }

    private static String keyValues(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder();
        fields.forEach((k, v) -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_LOGGED_CHARS) {
                return s.substring(0, MAX_LOGGED_CHARS) + "...(" + (s.length() - MAX_LOGGED_CHARS) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
