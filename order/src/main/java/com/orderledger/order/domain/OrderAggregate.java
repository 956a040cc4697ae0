package com.orderledger.order.domain;

import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.domain.events.OrderEventVisitor;
import com.orderledger.order.domain.events.OrderEvents.OrderCancelledEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;
import com.orderledger.order.exception.ErrorMessages;
import com.orderledger.order.exception.InvalidOrderCommandException;
import com.orderledger.order.exception.OrderConflictException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event-sourced Order aggregate.
 *
 * State is never stored as a mutable row; it is the fold of the order's stream.
 * Behavior methods validate against the folded state and return the events they would produce,
 * without touching storage. Callers apply the returned events so the instance stays current.
 *
 * Lifecycle: created → items added (any number) → shipped | cancelled. Shipped and cancelled
 * are terminal for ship, cancel and addItem.
 */
@Getter
public class OrderAggregate {

    private String id;
    private String customerId;
    private String description;
    private boolean shipped;
    private boolean cancelled;
    private final Map<String, LineItem> items = new LinkedHashMap<>();

    /** Number of events folded into this instance; equals the stream version. */
    private long version;

    public Map<String, LineItem> getItems() {
        return Collections.unmodifiableMap(items);
    }

    // ─── Behavior ─────────────────────────────────────────────────────────────

    public static List<OrderEvent> create(String orderId, String customerId, String description, Instant occurredAt) {
        return List.of(new OrderCreatedEvent(orderId, customerId, description, occurredAt));
    }

    public List<OrderEvent> addItem(String itemId, String itemName, int quantity, Instant occurredAt) {
        if (shipped) throw new OrderConflictException(id, ErrorMessages.ORDER_ALREADY_SHIPPED);
        if (cancelled) throw new OrderConflictException(id, ErrorMessages.ORDER_CANCELLED);
        if (quantity <= 0) throw new InvalidOrderCommandException(ErrorMessages.INVALID_QUANTITY);

        return List.of(new OrderItemAddedEvent(id, itemId, itemName, quantity, occurredAt));
    }

    public List<OrderEvent> ship(Instant occurredAt) {
        if (shipped) throw new OrderConflictException(id, ErrorMessages.ORDER_ALREADY_SHIPPED);
        if (cancelled) throw new OrderConflictException(id, ErrorMessages.ORDER_CANCELLED);

        return List.of(new OrderShippedEvent(id, occurredAt));
    }

    public List<OrderEvent> cancel(String reason, Instant occurredAt) {
        if (shipped) throw new OrderConflictException(id, ErrorMessages.CANNOT_CANCEL_SHIPPED_ORDER);
        if (cancelled) throw new OrderConflictException(id, ErrorMessages.ORDER_ALREADY_CANCELLED);

        return List.of(new OrderCancelledEvent(id, reason, occurredAt));
    }

    // ─── Folding ──────────────────────────────────────────────────────────────

    public void apply(OrderEvent event) {
        event.accept(applier);
        version++;
    }

    public void applyAll(List<? extends OrderEvent> events) {
        events.forEach(this::apply);
    }

    public static OrderAggregate replay(List<? extends OrderEvent> events) {
        OrderAggregate aggregate = new OrderAggregate();
        aggregate.applyAll(events);
        return aggregate;
    }

    @Getter(AccessLevel.NONE)
    private final OrderEventVisitor<Void> applier = new OrderEventVisitor<>() {
        @Override
        public Void visit(OrderCreatedEvent event) {
            id = event.getOrderId();
            customerId = event.getCustomerId();
            description = event.getDescription();
            return null;
        }

        @Override
        public Void visit(OrderItemAddedEvent event) {
            // Same item id accumulates quantity and keeps the first name seen
            items.merge(event.getItemId(),
                    new LineItem(event.getItemName(), event.getQuantity()),
                    (existing, added) -> new LineItem(existing.getName(), existing.getQuantity() + added.getQuantity()));
            return null;
        }

        @Override
        public Void visit(OrderShippedEvent event) {
            shipped = true;
            return null;
        }

        @Override
        public Void visit(OrderCancelledEvent event) {
            cancelled = true;
            return null;
        }
    };

    // ─── Snapshots ────────────────────────────────────────────────────────────

    public Snapshot toSnapshot() {
        return Snapshot.builder()
                .id(id)
                .customerId(customerId)
                .description(description)
                .shipped(shipped)
                .cancelled(cancelled)
                .items(new LinkedHashMap<>(items))
                .version(version)
                .build();
    }

    public static OrderAggregate fromSnapshot(Snapshot snapshot) {
        OrderAggregate aggregate = new OrderAggregate();
        aggregate.id = snapshot.getId();
        aggregate.customerId = snapshot.getCustomerId();
        aggregate.description = snapshot.getDescription();
        aggregate.shipped = snapshot.isShipped();
        aggregate.cancelled = snapshot.isCancelled();
        if (snapshot.getItems() != null) aggregate.items.putAll(snapshot.getItems());
        aggregate.version = snapshot.getVersion();
        return aggregate;
    }

    @Value
    @Builder
    @Jacksonized
    public static class LineItem {
        String name;
        int quantity;
    }

    /**
     * Point-in-time copy of the folded state, serialized into the snapshot table.
     */
    @Value
    @Builder
    @Jacksonized
    public static class Snapshot {
        String id;
        String customerId;
        String description;
        boolean shipped;
        boolean cancelled;
        Map<String, LineItem> items;
        long version;
    }
}
