package com.orderledger.order.domain.events;

import com.orderledger.order.domain.events.OrderEvents.OrderCancelledEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;

/**
 * One method per Order event type. Adding an event type adds a method here, which breaks the build
 * of every fold that has not handled it yet.
 */
public interface OrderEventVisitor<R> {

    R visit(OrderCreatedEvent event);

    R visit(OrderItemAddedEvent event);

    R visit(OrderShippedEvent event);

    R visit(OrderCancelledEvent event);
}
