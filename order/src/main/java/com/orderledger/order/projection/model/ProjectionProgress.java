package com.orderledger.order.projection.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Checkpoint of one asynchronous shard: the last global sequence whose read-model writes
 * committed. Written in the same transaction as those writes.
 */
@Entity
@Table(name = "projection_progress")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionProgress {

    @Id
    @Column(name = "shard_name", length = 100)
    private String shardName;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void advanceTo(long sequence, Instant now) {
        this.lastSequence = sequence;
        this.updatedAt = now;
    }

    public void reset(Instant now) {
        advanceTo(0L, now);
    }
}
