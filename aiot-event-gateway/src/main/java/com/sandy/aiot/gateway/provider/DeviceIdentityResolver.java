package com.sandy.aiot.gateway.provider;

import com.sandy.aiot.gateway.vo.DeviceInfo;
import com.sandy.aiot.gateway.vo.SimilarDevice;

import java.util.List;
import java.util.Optional;

/**
 * Device directory: resolves user references to devices and finds related ones.
 */
public interface DeviceIdentityResolver {

    /** Exact id, then exact name, then closest fuzzy name match. */
    Optional<DeviceInfo> resolve(String nameOrId);

    List<DeviceInfo> listDevices();

    /** Devices most alike the given one, best first, never including itself. */
    List<SimilarDevice> findSimilar(String deviceId, int limit);
}
