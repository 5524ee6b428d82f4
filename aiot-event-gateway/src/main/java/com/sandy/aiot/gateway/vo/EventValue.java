package com.sandy.aiot.gateway.vo;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed, lazily interpreted view over an event's raw JSON value.
 * <p>
 * Nothing is validated at ingestion; a consumer asks for the shape it expects and gets an
 * empty {@link Optional} when the value does not fit. Unknown shapes stay {@link Kind#STRUCTURED}.
 */
public final class EventValue {

    public enum Kind { NULL, NUMBER, TEXT, BOOLEAN, STRUCTURED }

    private static final EventValue NULL_VALUE = new EventValue(Kind.NULL, null);

    private final Kind kind;
    private final JsonNode raw;

    private EventValue(Kind kind, JsonNode raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static EventValue of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NULL_VALUE;
        if (node.isNumber()) return new EventValue(Kind.NUMBER, node);
        if (node.isTextual()) return new EventValue(Kind.TEXT, node);
        if (node.isBoolean()) return new EventValue(Kind.BOOLEAN, node);
        return new EventValue(Kind.STRUCTURED, node);
    }

    public Kind kind() { return kind; }

    public JsonNode raw() { return raw; }

    public boolean isNull() { return kind == Kind.NULL; }

    /**
     * Numeric reading. Numeric strings (e.g. "15") are accepted, as some integrations send them.
     */
    public Optional<Double> asDouble() {
        switch (kind) {
            case NUMBER:
                return Optional.of(raw.doubleValue());
            case TEXT:
                String s = raw.textValue().trim();
                if (s.isEmpty()) return Optional.empty();
                try {
                    double d = Double.parseDouble(s);
                    return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            default:
                return Optional.empty();
        }
    }

    public Optional<String> asText() {
        switch (kind) {
            case TEXT:
                return Optional.of(raw.textValue());
            case NUMBER:
            case BOOLEAN:
                return Optional.of(raw.asText());
            default:
                return Optional.empty();
        }
    }

    public Optional<Boolean> asBoolean() {
        if (kind == Kind.BOOLEAN) return Optional.of(raw.booleanValue());
        if (kind == Kind.TEXT) {
            String s = raw.textValue();
            if ("true".equalsIgnoreCase(s)) return Optional.of(true);
            if ("false".equalsIgnoreCase(s)) return Optional.of(false);
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventValue that)) return false;
        return kind == that.kind && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return raw == null ? "null" : raw.toString();
    }
}
