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
public class SystemStatusReport {
    private int totalDevices;
    private int healthyDevices;
    private int warningDevices;
    private int criticalDevices;
    /** Devices whose health could not be fetched. */
    private int unknownDevices;
    @Builder.Default
    private List<Pattern> correlatedFindings = new ArrayList<>();
    @Builder.Default
    private List<String> recentIssues = new ArrayList<>();
}
