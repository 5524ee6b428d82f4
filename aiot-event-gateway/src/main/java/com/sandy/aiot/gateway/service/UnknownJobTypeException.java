package com.sandy.aiot.gateway.service;

public class UnknownJobTypeException extends RuntimeException {
    public UnknownJobTypeException(String type) {
        super("No handler registered for job type " + type);
    }
}
