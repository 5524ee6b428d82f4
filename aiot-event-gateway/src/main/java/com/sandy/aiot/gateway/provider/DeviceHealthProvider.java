package com.sandy.aiot.gateway.provider;

import com.sandy.aiot.gateway.vo.DeviceHealth;

/**
 * Current health snapshot of one device.
 */
public interface DeviceHealthProvider {

    /**
     * @throws java.util.NoSuchElementException if the device is unknown
     */
    DeviceHealth getHealth(String deviceId);
}
