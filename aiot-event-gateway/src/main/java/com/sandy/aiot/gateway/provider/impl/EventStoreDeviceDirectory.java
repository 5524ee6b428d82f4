package com.sandy.aiot.gateway.provider.impl;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.provider.DeviceIdentityResolver;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.tools.Levenshtein;
import com.sandy.aiot.gateway.vo.DeviceInfo;
import com.sandy.aiot.gateway.vo.SimilarDevice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Device directory built from what the event store has seen.
 * Similarity: capability overlap (Jaccard), plus a small bonus for sharing a location.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventStoreDeviceDirectory implements DeviceIdentityResolver {

    static final double FUZZY_THRESHOLD = 0.6;
    private static final double SAME_LOCATION_BONUS = 0.1;

    private final EventStore eventStore;

    @Override
    public Optional<DeviceInfo> resolve(String nameOrId) {
        if (nameOrId == null || nameOrId.isBlank()) return Optional.empty();
        String ref = nameOrId.trim();
        List<DeviceInfo> devices = listDevices();
        for (DeviceInfo d : devices) {
            if (d.getId().equals(ref)) return Optional.of(d);
        }
        for (DeviceInfo d : devices) {
            if (d.getName() != null && d.getName().equalsIgnoreCase(ref)) return Optional.of(d);
        }
        DeviceInfo best = null;
        double bestScore = FUZZY_THRESHOLD;
        for (DeviceInfo d : devices) {
            if (d.getName() == null) continue;
            double score = Levenshtein.similarity(ref, d.getName());
            if (score > bestScore) {
                bestScore = score;
                best = d;
            }
        }
        if (best != null) {
            log.debug("Device resolved by fuzzy match ref={} deviceId={} score={}", ref, best.getId(), String.format("%.2f", bestScore));
        }
        return Optional.ofNullable(best);
    }

    @Override
    public List<DeviceInfo> listDevices() {
        List<DeviceInfo> out = new ArrayList<>();
        for (String id : eventStore.knownDeviceIds()) {
            Optional<DeviceEvent> last = eventStore.latest(id);
            out.add(DeviceInfo.builder()
                    .id(id)
                    .name(last.map(DeviceEvent::getDeviceName).orElse(null))
                    .locationId(last.map(DeviceEvent::getLocationId).orElse(null))
                    .capabilities(new LinkedHashSet<>(eventStore.capabilitiesOf(id)))
                    .lastSeen(last.map(DeviceEvent::getTimestamp).orElse(null))
                    .build());
        }
        return out;
    }

    @Override
    public List<SimilarDevice> findSimilar(String deviceId, int limit) {
        List<DeviceInfo> devices = listDevices();
        DeviceInfo target = devices.stream().filter(d -> d.getId().equals(deviceId)).findFirst().orElse(null);
        if (target == null || limit <= 0) return List.of();
        List<SimilarDevice> scored = new ArrayList<>();
        for (DeviceInfo d : devices) {
            if (d.getId().equals(deviceId)) continue;
            double score = jaccard(target.getCapabilities(), d.getCapabilities());
            if (score == 0) continue;
            if (target.getLocationId() != null && Objects.equals(target.getLocationId(), d.getLocationId())) {
                score = Math.min(1.0, score + SAME_LOCATION_BONUS);
            }
            scored.add(SimilarDevice.builder().device(d).score(score).build());
        }
        scored.sort(Comparator.comparingDouble(SimilarDevice::getScore).reversed());
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0;
        Set<String> inter = new HashSet<>(a);
        inter.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) inter.size() / union.size();
    }
}
