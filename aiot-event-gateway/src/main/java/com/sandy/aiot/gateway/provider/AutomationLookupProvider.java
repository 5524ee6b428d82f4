package com.sandy.aiot.gateway.provider;

import com.sandy.aiot.gateway.vo.AutomationMatch;

import java.util.List;

public interface AutomationLookupProvider {

    List<AutomationMatch> findAutomationsForDevice(String deviceId);
}
