package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.vo.CorrelationImpact;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternEvidence;
import com.sandy.aiot.gateway.vo.PatternType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-device findings of the same type into one cross-device finding when at least
 * two devices report it. Severity follows {@link CorrelationImpact}.
 */
@Component
public class PatternCorrelator {

    public List<Pattern> correlate(Map<String, List<Pattern>> patternsByDevice) {
        Map<PatternType, List<Pattern>> byType = new EnumMap<>(PatternType.class);
        Map<PatternType, Set<String>> devicesByType = new EnumMap<>(PatternType.class);
        patternsByDevice.forEach((deviceId, patterns) -> {
            if (patterns == null) return;
            for (Pattern p : patterns) {
                byType.computeIfAbsent(p.getType(), t -> new ArrayList<>()).add(p);
                devicesByType.computeIfAbsent(p.getType(), t -> new LinkedHashSet<>()).addAll(
                        p.getAffectedDevices().isEmpty() ? Set.of(deviceId) : p.getAffectedDevices());
            }
        });

        List<Pattern> findings = new ArrayList<>();
        byType.forEach((type, members) -> {
            Set<String> devices = devicesByType.get(type);
            if (devices.size() < 2) return;
            findings.add(merge(type, members, devices));
        });
        findings.sort(Pattern.BY_SEVERITY_THEN_CONFIDENCE);
        return findings;
    }

    private Pattern merge(PatternType type, List<Pattern> members, Set<String> devices) {
        CorrelationImpact impact = CorrelationImpact.forDeviceCount(devices.size());
        double confidence = members.stream().mapToDouble(Pattern::getConfidence).average().orElse(0);
        int occurrences = members.stream().mapToInt(Pattern::getOccurrences).sum();

        Instant start = null;
        Instant end = null;
        for (Pattern p : members) {
            PatternEvidence ev = p.getEvidence();
            if (ev == null) continue;
            if (ev.getStart() != null && (start == null || ev.getStart().isBefore(start))) start = ev.getStart();
            if (ev.getEnd() != null && (end == null || ev.getEnd().isAfter(end))) end = ev.getEnd();
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("deviceCount", (double) devices.size());
        metrics.put("memberFindings", (double) members.size());

        Set<String> recommendations = new LinkedHashSet<>();
        if (impact != CorrelationImpact.LOW) {
            recommendations.add("Several devices share this issue; look for a common cause (hub, network, shared automation)");
        }
        members.forEach(p -> recommendations.addAll(p.getRecommendations()));

        String label = type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Pattern.of(type, impact.severity(), confidence, occurrences, devices,
                label + " affecting " + devices.size() + " devices (impact " + impact + ")",
                PatternEvidence.builder().start(start).end(end).metrics(metrics).build(),
                new ArrayList<>(recommendations));
    }
}
