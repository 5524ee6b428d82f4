package com.sandy.aiot.gateway.provider.impl;

import com.sandy.aiot.gateway.provider.AutomationLookupProvider;
import com.sandy.aiot.gateway.vo.AutomationMatch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default when no automation platform is wired in: the device is in no known automation.
 */
@Component
public class NoopAutomationLookupProvider implements AutomationLookupProvider {

    @Override
    public List<AutomationMatch> findAutomationsForDevice(String deviceId) {
        return List.of();
    }
}
