package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternDetectionResult {
    private String deviceId;
    @Builder.Default
    private List<Pattern> patterns = new ArrayList<>();
    private long executionTimeMs;
    private int eventsAnalyzed;
    private boolean allAlgorithmsSucceeded;
    /** algorithm name: failure message */
    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
