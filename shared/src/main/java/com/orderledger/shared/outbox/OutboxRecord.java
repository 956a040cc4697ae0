package com.orderledger.shared.outbox;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Outbox record: a staged message written in the same transaction as the events it describes.
 *
 *   1. BEGIN TRANSACTION
 *      INSERT INTO order_events (...)   -- stream append
 *      INSERT INTO outbox (...)         -- one row per appended event
 *      UPSERT read models (...)         -- inline projections
 *   2. COMMIT
 *   3. Relay reads committed rows, publishes to Kafka, marks them published
 *
 * A row is only visible to the relay once the commit succeeds, so a message can never
 * be delivered for events that were rolled back. Delivery after commit is at-least-once.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_unpublished",
           columnList = "published_at, retry_count, created_at"),
    @Index(name = "idx_outbox_aggregate",
           columnList = "aggregate_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxRecord {

    public static final int MAX_ATTEMPTS = 5;

    /** Same UUID as the event id */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    /** NULL until Kafka acknowledged the message */
    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    /** Relay skips records where nextRetryAt > now */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isExhausted() {
        return retryCount >= MAX_ATTEMPTS;
    }

    public void markPublished(Instant now) {
        this.publishedAt = now;
        this.lastError = null;
        this.updatedAt = now;
    }

    /** Backoff: 5s, 10s, 20s, 40s, 80s */
    public void recordFailure(String errorMessage, Instant now) {
        this.retryCount++;
        this.lastError = errorMessage;
        long backoffSeconds = (1L << (retryCount - 1)) * 5L;
        this.nextRetryAt = now.plusSeconds(backoffSeconds);
        this.updatedAt = now;
    }
}
