package com.orderledger.order.domain.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderledger.shared.events.EventTypes;
import lombok.Getter;

import java.time.Instant;

/**
 * All Order event payload classes.
 * Each event extends OrderEvent and adds its specific payload.
 *
 * Events are immutable once appended. To evolve a payload, add a new event type
 * rather than changing the shape of an existing one.
 */
public final class OrderEvents {

    private OrderEvents() {}

    /**
     * Maps a stored type name back to its payload class.
     */
    public static Class<? extends OrderEvent> classFor(String eventType) {
        return switch (eventType) {
            case EventTypes.ORDER_CREATED -> OrderCreatedEvent.class;
            case EventTypes.ORDER_ITEM_ADDED -> OrderItemAddedEvent.class;
            case EventTypes.ORDER_SHIPPED -> OrderShippedEvent.class;
            case EventTypes.ORDER_CANCELLED -> OrderCancelledEvent.class;
            default -> throw new IllegalArgumentException("Unknown order event type: " + eventType);
        };
    }

    @Getter
    public static class OrderCreatedEvent extends OrderEvent {
        private final String customerId;
        private final String description;

        public OrderCreatedEvent(String orderId, String customerId, String description, Instant occurredAt) {
            this(null, orderId, customerId, description, occurredAt);
        }

        @JsonCreator
        public OrderCreatedEvent(@JsonProperty("id") String id,
                                 @JsonProperty("orderId") String orderId,
                                 @JsonProperty("customerId") String customerId,
                                 @JsonProperty("description") String description,
                                 @JsonProperty("occurredAt") Instant occurredAt) {
            super(id, EventTypes.ORDER_CREATED, orderId, occurredAt);
            this.customerId = customerId;
            this.description = description;
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    public static class OrderItemAddedEvent extends OrderEvent {
        private final String itemId;
        private final String itemName;
        private final int quantity;

        public OrderItemAddedEvent(String orderId, String itemId, String itemName, int quantity, Instant occurredAt) {
            this(null, orderId, itemId, itemName, quantity, occurredAt);
        }

        @JsonCreator
        public OrderItemAddedEvent(@JsonProperty("id") String id,
                                   @JsonProperty("orderId") String orderId,
                                   @JsonProperty("itemId") String itemId,
                                   @JsonProperty("itemName") String itemName,
                                   @JsonProperty("quantity") int quantity,
                                   @JsonProperty("occurredAt") Instant occurredAt) {
            super(id, EventTypes.ORDER_ITEM_ADDED, orderId, occurredAt);
            this.itemId = itemId;
            this.itemName = itemName;
            this.quantity = quantity;
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    public static class OrderShippedEvent extends OrderEvent {

        public OrderShippedEvent(String orderId, Instant occurredAt) {
            this(null, orderId, occurredAt);
        }

        @JsonCreator
        public OrderShippedEvent(@JsonProperty("id") String id,
                                 @JsonProperty("orderId") String orderId,
                                 @JsonProperty("occurredAt") Instant occurredAt) {
            super(id, EventTypes.ORDER_SHIPPED, orderId, occurredAt);
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    public static class OrderCancelledEvent extends OrderEvent {
        private final String reason;

        public OrderCancelledEvent(String orderId, String reason, Instant occurredAt) {
            this(null, orderId, reason, occurredAt);
        }

        @JsonCreator
        public OrderCancelledEvent(@JsonProperty("id") String id,
                                   @JsonProperty("orderId") String orderId,
                                   @JsonProperty("reason") String reason,
                                   @JsonProperty("occurredAt") Instant occurredAt) {
            super(id, EventTypes.ORDER_CANCELLED, orderId, occurredAt);
            this.reason = reason;
        }

        @Override
        public <R> R accept(OrderEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
