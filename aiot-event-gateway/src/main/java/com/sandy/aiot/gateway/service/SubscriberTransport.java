package com.sandy.aiot.gateway.service;

import java.io.IOException;

/**
 * One live-stream connection as seen by the broadcast hub.
 */
public interface SubscriberTransport {

    String id();

    /** Sends one named event. Any exception marks the transport as dead. */
    void send(String eventName, Object data) throws IOException;

    void close();
}
