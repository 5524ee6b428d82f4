package com.sandy.aiot.gateway.service.impl;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.service.SubscriberTransport;
import com.sandy.aiot.gateway.vo.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out of stored events to live subscribers.
 * <p>
 * The subscriber map is only mutated under {@link #lock}. Delivery works on a snapshot taken
 * under the lock and runs on a single dispatcher thread, so publishers never wait on slow
 * transports and events reach every subscriber in publish order. A transport that fails a
 * send is pruned; other subscribers are unaffected.
 */
@Service
@Slf4j
public class BroadcastHub {

    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_HEARTBEAT = "heartbeat";
    public static final String EVENT_NEW = "new-event";

    private final Object lock = new Object();
    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    @Value("${gateway.stream.heartbeat-interval-ms:30000}")
    private long heartbeatIntervalMs;
    @Value("${gateway.stream.emitter-timeout-ms:0}")
    private long emitterTimeoutMs;
    @Value("${gateway.stream.heartbeat-senders:4}")
    private int heartbeatSenderCount = 4;

    private ExecutorService dispatcher;
    /** Only fires the ticks; sends run on {@link #heartbeatSenders}. */
    private ScheduledExecutorService heartbeats;
    private ExecutorService heartbeatSenders;

    private static final class Subscriber {
        final SubscriberTransport transport;
        volatile ScheduledFuture<?> heartbeat;
        // at most one queued or running heartbeat per subscriber
        final AtomicBoolean heartbeatPending = new AtomicBoolean();

        Subscriber(SubscriberTransport transport) {
            this.transport = transport;
        }
    }

    @PostConstruct
    public void init() {
        dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "broadcast-dispatcher");
            t.setDaemon(true);
            return t;
        });
        heartbeats = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "broadcast-heartbeat");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger senderSeq = new AtomicInteger();
        heartbeatSenders = Executors.newFixedThreadPool(Math.max(1, heartbeatSenderCount), r -> {
            Thread t = new Thread(r, "broadcast-heartbeat-sender-" + senderSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Broadcast hub initialized: heartbeatIntervalMs={} heartbeatSenders={} emitterTimeoutMs={}",
                heartbeatIntervalMs, heartbeatSenderCount, emitterTimeoutMs);
    }

    @PreDestroy
    public void shutdown() {
        List<Subscriber> all;
        synchronized (lock) {
            all = new ArrayList<>(subscribers.values());
            subscribers.clear();
        }
        all.forEach(this::close);
        heartbeats.shutdownNow();
        heartbeatSenders.shutdownNow();
        dispatcher.shutdownNow();
    }

    /** New SSE subscription; completion, timeout and error of the emitter unsubscribe it. */
    public Subscription subscribe() {
        String clientId = UUID.randomUUID().toString();
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        emitter.onCompletion(() -> unsubscribe(clientId));
        emitter.onTimeout(() -> unsubscribe(clientId));
        emitter.onError(e -> unsubscribe(clientId));
        subscribe(new SseSubscriberTransport(clientId, emitter));
        return new Subscription(clientId, emitter);
    }

    public String subscribe(SubscriberTransport transport) {
        Subscriber sub = new Subscriber(transport);
        int count;
        synchronized (lock) {
            subscribers.put(transport.id(), sub);
            count = subscribers.size();
        }
        log.info("Stream client connected clientId={} connectedClients={}", transport.id(), count);

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("timestamp", Instant.now().toString());
        hello.put("message", "Connected to event stream");
        hello.put("clientId", transport.id());
        if (!deliver(sub, EVENT_CONNECTED, hello)) {
            return transport.id();
        }
        if (heartbeatIntervalMs > 0) {
            sub.heartbeat = heartbeats.scheduleAtFixedRate(() -> scheduleHeartbeat(sub),
                    heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
            boolean stillConnected;
            synchronized (lock) {
                stillConnected = subscribers.get(transport.id()) == sub;
            }
            if (!stillConnected) sub.heartbeat.cancel(false);
        }
        return transport.id();
    }

    public void unsubscribe(String clientId) {
        Subscriber removed;
        int count;
        synchronized (lock) {
            removed = subscribers.remove(clientId);
            count = subscribers.size();
        }
        if (removed == null) return;
        close(removed);
        log.info("Stream client disconnected clientId={} connectedClients={}", clientId, count);
    }

    /**
     * Queues the event for delivery and returns immediately. The future completes with the
     * number of subscribers that received it.
     */
    public CompletableFuture<Integer> publish(DeviceEvent event) {
        return CompletableFuture.supplyAsync(() -> broadcast(EVENT_NEW, event), dispatcher);
    }

    public int connectedClients() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    private int broadcast(String eventName, Object data) {
        List<Subscriber> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(subscribers.values());
        }
        int delivered = 0;
        for (Subscriber sub : snapshot) {
            if (deliver(sub, eventName, data)) delivered++;
        }
        if (log.isDebugEnabled()) {
            log.debug("Broadcast event={} delivered={} subscribers={}", eventName, delivered, snapshot.size());
        }
        return delivered;
    }

    /** A subscriber blocked in send skips its own ticks and holds at most one sender thread. */
    private void scheduleHeartbeat(Subscriber sub) {
        if (!sub.heartbeatPending.compareAndSet(false, true)) return;
        try {
            heartbeatSenders.execute(() -> {
                try {
                    sendHeartbeat(sub);
                } finally {
                    sub.heartbeatPending.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            sub.heartbeatPending.set(false);
            log.debug("Heartbeat not scheduled clientId={} message={}", sub.transport.id(), e.getMessage());
        }
    }

    private void sendHeartbeat(Subscriber sub) {
        Map<String, Object> beat = new LinkedHashMap<>();
        beat.put("timestamp", Instant.now().toString());
        beat.put("connectedClients", connectedClients());
        deliver(sub, EVENT_HEARTBEAT, beat);
    }

    private boolean deliver(Subscriber sub, String eventName, Object data) {
        try {
            sub.transport.send(eventName, data);
            return true;
        } catch (Exception e) {
            log.warn("Pruning stream client clientId={} event={} errorType={} message={}",
                    sub.transport.id(), eventName, e.getClass().getSimpleName(), e.getMessage());
            prune(sub);
            return false;
        }
    }

    private void prune(Subscriber sub) {
        String id = sub.transport.id();
        boolean removed;
        synchronized (lock) {
            removed = subscribers.remove(id, sub);
        }
        if (removed) close(sub);
    }

    private void close(Subscriber sub) {
        ScheduledFuture<?> hb = sub.heartbeat;
        if (hb != null) hb.cancel(false);
        try {
            sub.transport.close();
        } catch (RuntimeException e) {
            log.debug("Transport close failed clientId={} error={}", sub.transport.id(), e.getMessage());
        }
    }
}
