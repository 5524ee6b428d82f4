package com.sandy.aiot.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.entity.EventSource;
import com.sandy.aiot.gateway.vo.NormalizationResult;
import com.sandy.aiot.gateway.vo.NormalizationResult.Lifecycle;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a verified webhook envelope into canonical {@link DeviceEvent}s, or into the
 * synchronous acknowledgment for lifecycle control messages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventNormalizer {

    private final ObjectMapper objectMapper;

    @Value("${gateway.normalizer.capabilities:switch,switchLevel,lock,contactSensor,motionSensor,presenceSensor,"
            + "temperatureMeasurement,relativeHumidityMeasurement,illuminanceMeasurement,battery,powerMeter,energyMeter,"
            + "doorControl,garageDoorControl,valve,waterSensor,smokeDetector,carbonMonoxideDetector,occupancySensor,"
            + "thermostatMode,thermostatHeatingSetpoint,thermostatCoolingSetpoint,thermostatOperatingState,"
            + "colorControl,colorTemperature,windowShade,button,alarm,fanSpeed,audioVolume,healthCheck}")
    private String capabilityList;

    private Set<String> capabilities;

    @PostConstruct
    public void init() {
        capabilities = Arrays.stream(capabilityList.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        log.info("Event normalizer initialized: recognisedCapabilities={}", capabilities.size());
    }

    public boolean isRecognised(String capability) {
        return capability != null && capabilities.contains(capability);
    }

    public NormalizationResult normalize(byte[] rawBody) {
        JsonNode root = parse(rawBody);
        Lifecycle lifecycle = lifecycleOf(root);
        switch (lifecycle) {
            case PING: {
                String challenge = root.path("pingData").path("challenge").asText(null);
                if (challenge == null || challenge.isEmpty()) {
                    throw new MalformedPayloadException("Missing challenge in PING request");
                }
                return control(lifecycle, Map.of("challenge", challenge), "pingData");
            }
            case CONFIRMATION: {
                String url = root.path("confirmationData").path("confirmationUrl").asText(null);
                if (url == null || url.isEmpty()) {
                    throw new MalformedPayloadException("Missing confirmationUrl");
                }
                return control(lifecycle, Map.of("targetUrl", url), "confirmationData");
            }
            case UNINSTALL:
                return control(lifecycle, null, null);
            default:
                return normalizeEvents(root.path("eventData"));
        }
    }

    private NormalizationResult normalizeEvents(JsonNode eventData) {
        JsonNode events = eventData.path("events");
        if (!events.isMissingNode() && !events.isNull() && !events.isArray()) {
            throw new MalformedPayloadException("eventData.events must be an array");
        }
        String locationId = eventData.path("installedApp").path("locationId").asText(null);
        Instant receivedAt = Instant.now();
        List<DeviceEvent> out = new ArrayList<>();
        int dropped = 0;
        for (JsonNode raw : events) {
            DeviceEvent e = toDeviceEvent(raw, locationId, receivedAt);
            if (e == null) {
                dropped++;
            } else {
                out.add(e);
            }
        }
        if (dropped > 0) {
            log.warn("Dropped unrecognised events count={} kept={}", dropped, out.size());
        }
        return NormalizationResult.builder()
                .lifecycle(Lifecycle.EVENT)
                .events(out)
                .droppedEvents(dropped)
                .build();
    }

    private DeviceEvent toDeviceEvent(JsonNode raw, String locationId, Instant receivedAt) {
        JsonNode node = raw.has("deviceEvent") ? raw.get("deviceEvent") : raw;
        String deviceId = text(node, "deviceId");
        String capability = text(node, "capability");
        if (deviceId == null) {
            log.warn("Dropping event without deviceId eventId={}", text(raw, "eventId"));
            return null;
        }
        if (!isRecognised(capability)) {
            log.warn("Dropping event with unrecognised capability deviceId={} capability={}", deviceId, capability);
            return null;
        }
        String id = firstNonNull(text(raw, "eventId"), text(node, "eventId"));
        Instant time = parseTime(firstNonNull(text(raw, "eventTime"), text(node, "eventTime")), receivedAt);
        JsonNode value = node.has("value") ? node.get("value").deepCopy() : NullNode.getInstance();
        Boolean stateChange = node.has("stateChange") && node.get("stateChange").isBoolean()
                ? node.get("stateChange").booleanValue() : null;
        return DeviceEvent.builder()
                .id(id != null ? id : UUID.randomUUID().toString())
                .deviceId(deviceId)
                .deviceName(text(node, "deviceName"))
                .locationId(firstNonNull(text(node, "locationId"), locationId))
                .component(firstNonNull(text(node, "componentId"), "main"))
                .capability(capability)
                .attribute(text(node, "attribute"))
                .value(value)
                .unit(text(node, "unit"))
                .timestamp(time)
                .sequenceEpoch(time.toEpochMilli())
                .source(EventSource.WEBHOOK)
                .stateChange(stateChange)
                .receivedAt(receivedAt)
                .build();
    }

    private NormalizationResult control(Lifecycle lifecycle, Map<String, Object> data, String key) {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("statusCode", 200);
        if (key != null) ack.put(key, data);
        return NormalizationResult.builder().lifecycle(lifecycle).acknowledgment(ack).build();
    }

    private JsonNode parse(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedPayloadException("Empty webhook body");
        }
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new MalformedPayloadException("Webhook body must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Unreadable webhook body", e);
        }
    }

    private Lifecycle lifecycleOf(JsonNode root) {
        String value = text(root, "lifecycle");
        if (value == null) throw new MalformedPayloadException("Missing lifecycle");
        try {
            return Lifecycle.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Unknown lifecycle type " + value);
        }
    }

    private Instant parseTime(String value, Instant fallback) {
        if (value == null) return fallback;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparsable eventTime={} using receipt time", value);
            return fallback;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
