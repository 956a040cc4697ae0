package com.orderledger.order.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Order Event Store: Append-Only Event Log
 *
 * Every state change to an Order is recorded as an immutable event.
 * The log is partitioned by order id ({@code sequence} is the 1-based stream position)
 * and totally ordered across all streams by {@code global_sequence}, which is assigned under the
 * {@link EventSequence} row lock so that it never runs ahead of commit order.
 *
 * The unique key on (order_id, sequence) is the last line of defence for optimistic appends:
 * two writers that both decided against version N cannot both store position N + 1.
 */
@Entity
@Table(name = "order_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_order_events_stream_position", columnNames = {"order_id", "sequence"}),
        @UniqueConstraint(name = "uk_order_events_event_id", columnNames = {"event_id"})
    },
    indexes = {
        @Index(name = "idx_order_events_type", columnList = "event_type")
    })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEventRecord {

    @Id
    @Column(name = "global_sequence")         // Assigned from EventSequence, see OrderEventStore
    private Long globalSequence;

    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "order_id", nullable = false, length = 100)
    private String orderId;

    @Column(name = "sequence", nullable = false)
    private long sequence;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;            // Full serialized event JSON

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    void onPrePersist() {
        if (recordedAt == null) recordedAt = Instant.now();
    }
}
