package com.sandy.aiot.gateway.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.sandy.aiot.gateway.vo.EventValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical device state-change record. Created by the normalizer, written once by the
 * queue worker and never updated afterwards.
 * <p>
 * Per-device ordering uses {@code sequenceEpoch} (source reported), not arrival order.
 */
@Entity
@Table(name = "device_events", indexes = {
        @Index(name = "idx_events_device_seq", columnList = "device_id, sequence_epoch"),
        @Index(name = "idx_events_seq", columnList = "sequence_epoch"),
        @Index(name = "idx_events_time", columnList = "event_time")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEvent {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "device_id", length = 64, nullable = false)
    private String deviceId;

    @Column(length = 200)
    private String deviceName;

    @Column(length = 64)
    private String locationId;

    @Column(length = 64)
    private String component;

    @Column(length = 100)
    private String capability;

    @Column(length = 100)
    private String attribute;

    @Lob
    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "event_value", columnDefinition = "CLOB")
    private JsonNode value;

    @Column(length = 32)
    private String unit;

    /** Wall-clock time of the state change. */
    @Column(name = "event_time", nullable = false)
    private Instant timestamp;

    @Column(name = "sequence_epoch", nullable = false)
    private long sequenceEpoch;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private EventSource source;

    private Boolean stateChange;

    private Instant receivedAt;

    @Transient
    @JsonIgnore
    public EventValue typedValue() {
        return EventValue.of(value);
    }

    /** Detached copy used as pattern evidence; later purges of the stored row do not affect it. */
    @JsonIgnore
    public DeviceEvent copy() {
        return toBuilder().value(value == null ? null : value.deepCopy()).build();
    }
}
