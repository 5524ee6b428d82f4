package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A scored detection finding. Built fresh on every run and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pattern {

    /** Severity first, then confidence, both descending. */
    public static final Comparator<Pattern> BY_SEVERITY_THEN_CONFIDENCE =
            Comparator.comparingInt((Pattern p) -> p.getSeverity().rank()).reversed()
                    .thenComparing(Comparator.comparingDouble(Pattern::getConfidence).reversed());

    private PatternType type;
    private Severity severity;
    private double confidence;
    private int occurrences;
    @Builder.Default
    private Set<String> affectedDevices = new LinkedHashSet<>();
    private String description;
    private PatternEvidence evidence;
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
    private Instant detectedAt;

    /**
     * Builder shortcut that enforces the invariants every algorithm relies on.
     */
    public static Pattern of(PatternType type, Severity severity, double confidence, int occurrences,
                             Set<String> affectedDevices, String description,
                             PatternEvidence evidence, List<String> recommendations) {
        if (affectedDevices == null || affectedDevices.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + type + " must name at least one affected device");
        }
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
        }
        return Pattern.builder()
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .occurrences(occurrences)
                .affectedDevices(new LinkedHashSet<>(affectedDevices))
                .description(description)
                .evidence(evidence)
                .recommendations(recommendations == null ? new ArrayList<>() : new ArrayList<>(recommendations))
                .detectedAt(Instant.now())
                .build();
    }
}
