package com.sandy.aiot.gateway.service;

/**
 * Webhook body that cannot be interpreted. Permanent: the request is rejected and never retried.
 */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
