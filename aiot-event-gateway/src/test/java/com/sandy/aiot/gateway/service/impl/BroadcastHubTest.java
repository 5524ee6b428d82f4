package com.sandy.aiot.gateway.service.impl;

import com.sandy.aiot.gateway.service.SubscriberTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.sandy.aiot.gateway.TestEvents.switchEvent;
import static org.junit.jupiter.api.Assertions.*;

class BroadcastHubTest {

    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        hub = new BroadcastHub();
        ReflectionTestUtils.setField(hub, "heartbeatIntervalMs", 0L);
        hub.init();
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    static class RecordingTransport implements SubscriberTransport {
        final String id;
        final List<String> received = new CopyOnWriteArrayList<>();
        volatile boolean broken;
        volatile boolean closed;

        RecordingTransport(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void send(String eventName, Object data) throws IOException {
            if (broken) throw new IOException("Broken pipe");
            received.add(eventName);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void subscriberReceivesConnectedEventFirst() {
        RecordingTransport t = new RecordingTransport("c1");
        assertEquals("c1", hub.subscribe(t));
        assertEquals(List.of(BroadcastHub.EVENT_CONNECTED), t.received);
        assertEquals(1, hub.connectedClients());
    }

    @Test
    void deadTransportIsPrunedWithoutAffectingOthers() throws Exception {
        RecordingTransport a = new RecordingTransport("a");
        RecordingTransport b = new RecordingTransport("b");
        RecordingTransport c = new RecordingTransport("c");
        RecordingTransport stale = new RecordingTransport("stale");
        for (RecordingTransport t : List.of(a, b, c, stale)) hub.subscribe(t);
        assertEquals(4, hub.connectedClients());
        stale.broken = true;

        int delivered = hub.publish(switchEvent("d1", "on", Instant.now())).get(2, TimeUnit.SECONDS);

        assertEquals(3, delivered);
        assertEquals(3, hub.connectedClients());
        assertTrue(stale.closed);
        for (RecordingTransport t : List.of(a, b, c)) {
            assertEquals(List.of(BroadcastHub.EVENT_CONNECTED, BroadcastHub.EVENT_NEW), t.received);
            assertFalse(t.closed);
        }

        // next publish only reaches the survivors
        assertEquals(3, hub.publish(switchEvent("d1", "off", Instant.now())).get(2, TimeUnit.SECONDS));
    }

    @Test
    void transportFailingOnConnectIsNeverCounted() {
        RecordingTransport t = new RecordingTransport("dead");
        t.broken = true;
        hub.subscribe(t);
        assertEquals(0, hub.connectedClients());
        assertTrue(t.closed);
    }

    @Test
    void eventsArriveInPublishOrder() throws Exception {
        RecordingTransport t = new RecordingTransport("ordered");
        hub.subscribe(t);
        for (int i = 0; i < 20; i++) hub.publish(switchEvent("d1", i % 2 == 0 ? "on" : "off", Instant.now()));
        hub.publish(switchEvent("d1", "on", Instant.now())).get(2, TimeUnit.SECONDS);
        assertEquals(22, t.received.size());
    }

    @Test
    void unsubscribeClosesTransport() throws Exception {
        RecordingTransport t = new RecordingTransport("leaving");
        hub.subscribe(t);
        hub.unsubscribe("leaving");
        hub.unsubscribe("leaving");
        assertTrue(t.closed);
        assertEquals(0, hub.connectedClients());
        assertEquals(0, hub.publish(switchEvent("d1", "on", Instant.now())).get(2, TimeUnit.SECONDS));
    }

    @Test
    void heartbeatsAreSentOnInterval() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub();
        ReflectionTestUtils.setField(hub, "heartbeatIntervalMs", 50L);
        hub.init();
        RecordingTransport t = new RecordingTransport("hb");
        hub.subscribe(t);

        long deadline = System.currentTimeMillis() + 2_000;
        while (!t.received.contains(BroadcastHub.EVENT_HEARTBEAT) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(t.received.contains(BroadcastHub.EVENT_HEARTBEAT));
    }

    @Test
    void blockedSubscriberDoesNotDelayOtherHeartbeats() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub();
        ReflectionTestUtils.setField(hub, "heartbeatIntervalMs", 50L);
        hub.init();
        CountDownLatch unblock = new CountDownLatch(1);
        RecordingTransport stuck = new RecordingTransport("stuck") {
            @Override
            public void send(String eventName, Object data) throws IOException {
                super.send(eventName, data);
                if (BroadcastHub.EVENT_HEARTBEAT.equals(eventName)) {
                    try {
                        unblock.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        };
        RecordingTransport healthy = new RecordingTransport("healthy");
        try {
            hub.subscribe(stuck);
            hub.subscribe(healthy);

            long deadline = System.currentTimeMillis() + 2_000;
            while (heartbeats(healthy) < 3 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(heartbeats(healthy) >= 3, "healthy subscriber got " + heartbeats(healthy) + " heartbeats");
            // the stuck one is not piling up sends behind its first heartbeat
            assertEquals(1, heartbeats(stuck));
        } finally {
            unblock.countDown();
        }
    }

    private static long heartbeats(RecordingTransport t) {
        return t.received.stream().filter(BroadcastHub.EVENT_HEARTBEAT::equals).count();
    }
}
