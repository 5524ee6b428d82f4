package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventQuery {
    public enum Order { ASC, DESC }

    private Instant since;
    private Instant until;
    @Builder.Default
    private int limit = 50;
    @Builder.Default
    private Order order = Order.DESC;
    /** Optional source filter, only used for cross-device listings. */
    private String source;

    public static EventQuery latest(int limit) {
        return EventQuery.builder().limit(limit).order(Order.DESC).build();
    }

    public static EventQuery window(Instant since, int limit) {
        return EventQuery.builder().since(since).limit(limit).order(Order.ASC).build();
    }
}
