package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceInfo {
    private String id;
    private String name;
    private String locationId;
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();
    private Instant lastSeen;

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
