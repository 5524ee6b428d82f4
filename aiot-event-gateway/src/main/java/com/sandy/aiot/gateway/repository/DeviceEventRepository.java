package com.sandy.aiot.gateway.repository;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.entity.EventSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceEventRepository extends JpaRepository<DeviceEvent, String> {

    // 时间窗口统一用 sequenceEpoch (毫秒) 过滤，排序方向由 Pageable 决定
    List<DeviceEvent> findByDeviceIdAndSequenceEpochBetween(String deviceId, long from, long to, Pageable pageable);

    long countByDeviceIdAndSequenceEpochBetween(String deviceId, long from, long to);

    List<DeviceEvent> findBySequenceEpochBetween(long from, long to, Pageable pageable);

    long countBySequenceEpochBetween(long from, long to);

    List<DeviceEvent> findBySourceAndSequenceEpochBetween(EventSource source, long from, long to, Pageable pageable);

    long countBySourceAndSequenceEpochBetween(EventSource source, long from, long to);

    long countByReceivedAtAfter(Instant after);

    Optional<DeviceEvent> findTopByDeviceIdOrderBySequenceEpochDesc(String deviceId);

    Optional<DeviceEvent> findTopByDeviceIdAndCapabilityAndAttributeOrderBySequenceEpochDesc(String deviceId, String capability, String attribute);

    @Query("select distinct e.sequenceEpoch from DeviceEvent e where e.deviceId = :deviceId"
            + " and e.sequenceEpoch between :fromEpoch and :toEpoch order by e.sequenceEpoch")
    List<Long> findEpochs(@Param("deviceId") String deviceId, @Param("fromEpoch") long from, @Param("toEpoch") long to, Pageable pageable);

    @Query("select distinct e.deviceId from DeviceEvent e order by e.deviceId")
    List<String> findDistinctDeviceIds();

    @Query("select distinct e.capability from DeviceEvent e where e.deviceId = :deviceId and e.capability is not null")
    List<String> findDistinctCapabilities(@Param("deviceId") String deviceId);

    @Query("select e.id from DeviceEvent e where e.timestamp < :cutoff")
    List<String> findIdsOlderThan(@Param("cutoff") Instant cutoff, Pageable pageable);

    @Modifying
    @Transactional
    @Query("delete from DeviceEvent e where e.id in :ids")
    int deleteByIds(@Param("ids") Collection<String> ids);
}
