package com.orderledger.shared.outbox;

import com.orderledger.shared.events.DomainEvent;
import lombok.Getter;

import java.time.Instant;

@Getter
class TestEvent extends DomainEvent {

    private final String orderId;

    TestEvent(String id, String orderId, Instant occurredAt) {
        super(id, "orders.created", "/services/test", occurredAt);
        this.orderId = orderId;
    }
}
