package com.orderledger.order.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Named counter that hands out global sequences.
 *
 * Appenders lock the row for the rest of their transaction, so global sequences become
 * visible in the order they were assigned and a rolled-back append returns its numbers.
 */
@Entity
@Table(name = "event_sequences")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventSequence {

    public static final String ORDER_EVENTS = "order_events";

    @Id
    @Column(name = "name", length = 50)
    private String name;

    @Column(name = "last_value", nullable = false)
    private long lastValue;

    /**
     * Reserves {@code count} consecutive values.
     *
     * @return the first reserved value
     */
    public long allocate(int count) {
        long first = lastValue + 1;
        lastValue += count;
        return first;
    }
}
