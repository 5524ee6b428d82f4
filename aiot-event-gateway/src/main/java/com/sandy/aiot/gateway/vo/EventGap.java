package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventGap {
    private Instant start;
    private Instant end;
    private long durationMs;
    private String durationText;
    /** Longer than one hour: probably a connectivity problem rather than a quiet device. */
    private boolean suspicious;
}
