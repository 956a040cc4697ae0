package com.orderledger.order.domain.events;

import com.orderledger.shared.events.DomainEvent;
import com.orderledger.shared.events.EventTypes;
import lombok.Getter;

import java.time.Instant;

/**
 * Base type of the closed Order event family. The only subclasses are the ones in {@link OrderEvents};
 * every consumer folds them through {@link OrderEventVisitor}.
 */
@Getter
public abstract class OrderEvent extends DomainEvent {

    private final String orderId;

    protected OrderEvent(String id, String type, String orderId, Instant occurredAt) {
        super(id, type, EventTypes.SOURCE_ORDER_LEDGER, occurredAt);
        this.orderId = orderId;
    }

    public abstract <R> R accept(OrderEventVisitor<R> visitor);
}
