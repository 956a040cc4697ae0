package com.orderledger.order.projection.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Audit row for one event. Written once, keyed by event id, never updated.
 */
@Entity
@Table(name = "order_timeline", indexes = {
    @Index(name = "idx_order_timeline_order", columnList = "order_id, occurred_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTimelineEntry {

    @Id
    @Column(name = "id", length = 36)
    private String id;                 // Same as event ID

    @Column(name = "order_id", nullable = false, length = 100)
    private String orderId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "occurred_at")
    private Instant occurredAt;

    @Column(name = "global_sequence", nullable = false)
    private long globalSequence;
}
