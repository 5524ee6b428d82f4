package com.sandy.aiot.gateway.service.impl;

import com.sandy.aiot.gateway.service.SubscriberTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@Slf4j
public class SseSubscriberTransport implements SubscriberTransport {

    private final String id;
    private final SseEmitter emitter;

    public SseSubscriberTransport(String id, SseEmitter emitter) {
        this.id = id;
        this.emitter = emitter;
    }

    @Override
    public String id() {
        return id;
    }

    public SseEmitter emitter() {
        return emitter;
    }

    @Override
    public void send(String eventName, Object data) throws IOException {
        emitter.send(SseEmitter.event().name(eventName).data(data, MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (RuntimeException e) {
            log.debug("SSE emitter already closed clientId={} error={}", id, e.getMessage());
        }
    }
}
