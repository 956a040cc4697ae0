package com.orderledger.order.projection.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Lock row of one inline projection. Command transactions hold it shared while they write the
 * projection; a reset holds it exclusively while it deletes the documents.
 */
@Entity
@Table(name = "projection_guards")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionGuard {

    @Id
    @Column(name = "projection", length = 100)
    private String projection;
}
