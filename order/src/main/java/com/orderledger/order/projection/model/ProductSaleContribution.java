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

/**
 * One item-added event already counted into {@link ProductSales}, keyed by event id.
 * Written in the same transaction as the total it was added to.
 */
@Entity
@Table(name = "product_sale_contributions", indexes = {
    @Index(name = "idx_product_sale_contributions_item", columnList = "item_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSaleContribution {

    /** The event id */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "item_id", nullable = false, length = 100)
    private String itemId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "global_sequence", nullable = false)
    private long globalSequence;
}
