package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationMatch {
    private String id;
    private String name;
    private String description;
    private boolean enabled;
}
