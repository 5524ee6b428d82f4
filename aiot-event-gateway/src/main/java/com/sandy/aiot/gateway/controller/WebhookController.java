package com.sandy.aiot.gateway.controller;

import com.sandy.aiot.gateway.service.EventNormalizer;
import com.sandy.aiot.gateway.service.MalformedPayloadException;
import com.sandy.aiot.gateway.service.SignatureVerifier;
import com.sandy.aiot.gateway.service.impl.DeviceEventJobHandler;
import com.sandy.aiot.gateway.service.impl.DurableJobQueue;
import com.sandy.aiot.gateway.vo.NormalizationResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Platform webhook: verify, normalize, enqueue, answer. Nothing slower than an insert runs
 * on the request thread.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final SignatureVerifier signatureVerifier;
    private final EventNormalizer eventNormalizer;
    private final DurableJobQueue jobQueue;

    @Value("${gateway.webhook.secret:}")
    private String secret;
    @Value("${gateway.webhook.signature-header:X-ST-HMAC}")
    private String signatureHeader;

    @PostMapping(value = "/webhook/smartthings", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> receive(@RequestBody(required = false) byte[] body, HttpServletRequest request) {
        long start = System.currentTimeMillis();
        if (secret == null || secret.isEmpty()) {
            log.error("Webhook secret not configured (gateway.webhook.secret)");
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Webhook configuration error", null);
        }
        byte[] raw = body == null ? new byte[0] : body;
        if (!signatureVerifier.verify(raw, request.getHeader(signatureHeader), secret)) {
            log.warn("Webhook rejected: invalid signature bytes={}", raw.length);
            return error(HttpStatus.UNAUTHORIZED, "Unauthorized", "Invalid HMAC signature");
        }

        NormalizationResult result;
        try {
            result = eventNormalizer.normalize(raw);
        } catch (MalformedPayloadException e) {
            log.warn("Webhook rejected: malformed payload message={}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());
        }

        if (result.isControlMessage()) {
            log.info("Webhook lifecycle={} durationMs={}", result.getLifecycle(), System.currentTimeMillis() - start);
            Map<String, Object> ack = result.getAcknowledgment() != null ? result.getAcknowledgment() : Map.of("statusCode", 200);
            return ResponseEntity.ok(ack);
        }

        List<Long> jobIds = result.getEvents().isEmpty()
                ? List.of()
                : jobQueue.enqueueAll(DeviceEventJobHandler.TYPE, result.getEvents());
        log.info("Webhook events enqueued count={} dropped={} durationMs={}", jobIds.size(), result.getDroppedEvents(), System.currentTimeMillis() - start);
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("statusCode", 200);
        ack.put("enqueued", jobIds.size());
        ack.put("dropped", result.getDroppedEvents());
        return ResponseEntity.ok(ack);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null) body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
