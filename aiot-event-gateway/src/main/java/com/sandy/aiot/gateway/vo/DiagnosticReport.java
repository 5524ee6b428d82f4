package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticReport {
    private String summary;
    private DiagnosticContext context;
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
    /** Markdown rendering of the gathered context. */
    private String richContext;
    /** Data sources that failed or timed out; their sections are omitted, never guessed. */
    @Builder.Default
    private List<String> unavailableSources = new ArrayList<>();
    private long elapsedMs;
    private Instant timestamp;
}
