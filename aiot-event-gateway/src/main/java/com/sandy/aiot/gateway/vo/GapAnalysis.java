package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GapAnalysis {
    private long thresholdMs;
    @Builder.Default
    private List<EventGap> gaps = new ArrayList<>();
    @Builder.Default
    private List<EventGap> suspiciousGaps = new ArrayList<>();

    public boolean hasSuspiciousGap() {
        return suspiciousGaps != null && !suspiciousGaps.isEmpty();
    }

    public Optional<EventGap> largest() {
        if (gaps == null) return Optional.empty();
        return gaps.stream().max(Comparator.comparingLong(EventGap::getDurationMs));
    }

    public static GapAnalysis empty(long thresholdMs) {
        return GapAnalysis.builder().thresholdMs(thresholdMs).build();
    }
}
