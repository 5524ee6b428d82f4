package com.sandy.aiot.gateway.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Unit of durable work. Persisted before the enqueue call returns; claimed by exactly one
 * worker through a conditional status update.
 */
@Entity
@Table(name = "queue_jobs", indexes = {
        @Index(name = "idx_jobs_status_due", columnList = "status, next_run_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Handler discriminator, e.g. device_event. */
    @Column(length = 64, nullable = false)
    private String type;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String payload;

    private int attempts;
    private int maxAttempts;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private JobStatus status;

    @Column(length = 1000)
    private String lastError;

    @Column(length = 64)
    private String lockedBy;
    private Instant lockedAt;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
}
