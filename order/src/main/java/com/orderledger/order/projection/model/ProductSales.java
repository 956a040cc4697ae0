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
 * Sales of one item id, aggregated across every order stream.
 */
@Entity
@Table(name = "product_sales", indexes = {
    @Index(name = "idx_product_sales_total", columnList = "total_quantity_sold")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSales {

    /** The item id */
    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "product_name", length = 200)
    private String productName;

    @Column(name = "total_quantity_sold", nullable = false)
    private long totalQuantitySold;

    @Column(name = "last_sale_at")
    private Instant lastSaleAt;
}
