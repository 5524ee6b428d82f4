package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Handle returned to a new live-stream subscriber. The emitter is null for non-SSE transports.
 */
@Getter
@AllArgsConstructor
public class Subscription {
    private final String clientId;
    private final SseEmitter emitter;
}
