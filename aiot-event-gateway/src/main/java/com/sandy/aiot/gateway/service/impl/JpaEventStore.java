package com.sandy.aiot.gateway.service.impl;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.entity.EventSource;
import com.sandy.aiot.gateway.repository.DeviceEventRepository;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.tools.EventGaps;
import com.sandy.aiot.gateway.vo.EventPage;
import com.sandy.aiot.gateway.vo.EventQuery;
import com.sandy.aiot.gateway.vo.GapAnalysis;
import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaEventStore implements EventStore {

    private final DeviceEventRepository eventRepository;
    private final PlatformTransactionManager transactionManager;

    @PersistenceContext
    private EntityManager entityManager;

    @Value("${gateway.events.max-query-limit:500}")
    private int maxQueryLimit;
    @Value("${gateway.events.gap-threshold-ms:3600000}")
    private long gapThresholdMs;
    @Value("${gateway.events.retention-enabled:true}")
    private boolean retentionEnabled;
    @Value("${gateway.events.retention-days:30}")
    private int retentionDays;
    @Value("${gateway.events.retention-batch-size:500}")
    private int retentionBatchSize;

    private TransactionTemplate tx;

    @PostConstruct
    public void init() {
        tx = new TransactionTemplate(transactionManager);
        log.info("Event store initialized: maxQueryLimit={} gapThresholdMs={} retentionDays={}", maxQueryLimit, gapThresholdMs, retentionDays);
    }

    @Override
    public boolean append(DeviceEvent event) {
        if (event == null || event.getId() == null || event.getDeviceId() == null) {
            throw new IllegalArgumentException("event id and deviceId are required");
        }
        if (eventRepository.existsById(event.getId())) {
            log.debug("Duplicate event ignored eventId={} deviceId={}", event.getId(), event.getDeviceId());
            return false;
        }
        try {
            tx.executeWithoutResult(status -> {
                entityManager.persist(event);
                entityManager.flush();
            });
            return true;
        } catch (DataAccessException | PersistenceException e) {
            // concurrent insert of the same id
            if (eventRepository.existsById(event.getId())) {
                log.debug("Duplicate event lost insert race eventId={}", event.getId());
                return false;
            }
            throw e;
        }
    }

    @Override
    public List<DeviceEvent> query(String deviceId, EventQuery query) {
        EventQuery q = query != null ? query : EventQuery.latest(50);
        return eventRepository.findByDeviceIdAndSequenceEpochBetween(deviceId, from(q), to(q), page(q));
    }

    @Override
    public EventPage queryPage(String deviceId, EventQuery query) {
        EventQuery q = query != null ? query : EventQuery.latest(50);
        List<DeviceEvent> events = query(deviceId, q);
        long total = eventRepository.countByDeviceIdAndSequenceEpochBetween(deviceId, from(q), to(q));
        GapAnalysis gaps = detectGaps(events, gapThresholdMs);
        return EventPage.builder()
                .deviceId(deviceId)
                .events(events)
                .count(events.size())
                .totalCount(total)
                .hasMore(total > events.size())
                .gapDetected(!gaps.getGaps().isEmpty())
                .gaps(gaps.getGaps())
                .build();
    }

    @Override
    public GapAnalysis analyzeGaps(String deviceId, Instant since, Instant until, long thresholdMs) {
        long from = since == null ? Long.MIN_VALUE : since.toEpochMilli();
        long to = until == null ? Long.MAX_VALUE : until.toEpochMilli();
        // keyset walk over distinct epochs, one chunk per query
        List<Long> epochs = new ArrayList<>();
        while (from <= to) {
            List<Long> chunk = eventRepository.findEpochs(deviceId, from, to, PageRequest.of(0, maxQueryLimit));
            epochs.addAll(chunk);
            if (chunk.size() < maxQueryLimit) break;
            long last = chunk.get(chunk.size() - 1);
            if (last == Long.MAX_VALUE) break;
            from = last + 1;
        }
        log.debug("Gap analysis deviceId={} epochs={} thresholdMs={}", deviceId, epochs.size(), thresholdMs);
        return EventGaps.detectGapsInEpochs(epochs, thresholdMs);
    }

    @Override
    public List<DeviceEvent> recent(EventQuery query) {
        EventQuery q = query != null ? query : EventQuery.latest(50);
        EventSource source = sourceOf(q.getSource());
        if (source != null) {
            return eventRepository.findBySourceAndSequenceEpochBetween(source, from(q), to(q), page(q));
        }
        return eventRepository.findBySequenceEpochBetween(from(q), to(q), page(q));
    }

    @Override
    public long countRecent(EventQuery query) {
        EventQuery q = query != null ? query : EventQuery.latest(50);
        EventSource source = sourceOf(q.getSource());
        if (source != null) {
            return eventRepository.countBySourceAndSequenceEpochBetween(source, from(q), to(q));
        }
        return eventRepository.countBySequenceEpochBetween(from(q), to(q));
    }

    @Override
    public long count(String deviceId, Instant since) {
        long from = since == null ? Long.MIN_VALUE : since.toEpochMilli();
        if (deviceId == null) return eventRepository.countBySequenceEpochBetween(from, Long.MAX_VALUE);
        return eventRepository.countByDeviceIdAndSequenceEpochBetween(deviceId, from, Long.MAX_VALUE);
    }

    @Override
    public long countReceivedSince(Instant since) {
        return eventRepository.countByReceivedAtAfter(since);
    }

    @Override
    public List<String> knownDeviceIds() {
        return eventRepository.findDistinctDeviceIds();
    }

    @Override
    public Optional<DeviceEvent> latest(String deviceId) {
        return eventRepository.findTopByDeviceIdOrderBySequenceEpochDesc(deviceId);
    }

    @Override
    public Optional<DeviceEvent> latest(String deviceId, String capability, String attribute) {
        return eventRepository.findTopByDeviceIdAndCapabilityAndAttributeOrderBySequenceEpochDesc(deviceId, capability, attribute);
    }

    @Override
    public List<String> capabilitiesOf(String deviceId) {
        return eventRepository.findDistinctCapabilities(deviceId);
    }

    @Scheduled(fixedDelayString = "${gateway.events.retention-sweep-interval-ms:3600000}")
    public void scheduledRetentionSweep() {
        if (!retentionEnabled) return;
        try {
            purgeOlderThan(Instant.now().minus(Duration.ofDays(retentionDays)));
        } catch (Exception e) {
            log.error("Event retention sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Deletes in short id batches so each transaction only touches a bounded number of rows.
     */
    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        while (true) {
            List<String> ids = eventRepository.findIdsOlderThan(cutoff, PageRequest.of(0, retentionBatchSize));
            if (ids.isEmpty()) break;
            removed += eventRepository.deleteByIds(ids);
            if (ids.size() < retentionBatchSize) break;
        }
        if (removed > 0) log.info("Event retention sweep removed={} cutoff={}", removed, cutoff);
        return removed;
    }

    private Pageable page(EventQuery q) {
        int limit = Math.max(1, Math.min(q.getLimit(), maxQueryLimit));
        Sort.Direction dir = q.getOrder() == EventQuery.Order.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
        return PageRequest.of(0, limit, Sort.by(dir, "sequenceEpoch").and(Sort.by(dir, "id")));
    }

    private static long from(EventQuery q) {
        return q.getSince() == null ? Long.MIN_VALUE : q.getSince().toEpochMilli();
    }

    private static long to(EventQuery q) {
        return q.getUntil() == null ? Long.MAX_VALUE : q.getUntil().toEpochMilli();
    }

    private static EventSource sourceOf(String source) {
        if (source == null || source.isBlank()) return null;
        try {
            return EventSource.valueOf(source.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event source: " + source);
        }
    }
}
