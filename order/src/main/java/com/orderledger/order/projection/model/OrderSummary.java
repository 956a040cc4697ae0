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
import lombok.Setter;

import java.time.Instant;

/**
 * One document per order. {@code totalItems} is the running sum of every added quantity.
 */
@Entity
@Table(name = "order_summaries", indexes = {
    @Index(name = "idx_order_summaries_customer_id", columnList = "customer_id"),
    @Index(name = "idx_order_summaries_updated_at", columnList = "updated_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummary {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 100)
    private String customerId;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "shipped", nullable = false)
    private boolean shipped;

    @Column(name = "cancelled", nullable = false)
    private boolean cancelled;

    /** occurred-at of the last applied event */
    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Stream position of the last applied event; older or repeated positions are ignored */
    @Column(name = "version", nullable = false)
    private long version;
}
