package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticRequest {
    private DiagnosticIntent intent;
    /** Device id or (fuzzy) device name; ignored for system-wide intents. */
    private String device;
}
