package com.orderledger.shared.events;

/**
 * Canonical event type constants.
 * Event type names are persisted in the event log, so renaming one is a breaking change
 * that requires an upcaster for the stored history.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Order Domain ──────────────────────────────────────────────────────────
    public static final String ORDER_CREATED    = "orders.created";
    public static final String ORDER_ITEM_ADDED = "orders.item-added";
    public static final String ORDER_SHIPPED    = "orders.shipped";
    public static final String ORDER_CANCELLED  = "orders.cancelled";

    // ── Kafka Topics (same as event types for simplicity) ─────────────────────
    public static final String TOPIC_ORDERS_CREATED    = ORDER_CREATED;
    public static final String TOPIC_ORDERS_ITEM_ADDED = ORDER_ITEM_ADDED;
    public static final String TOPIC_ORDERS_SHIPPED    = ORDER_SHIPPED;
    public static final String TOPIC_ORDERS_CANCELLED  = ORDER_CANCELLED;

    public static final String SOURCE_ORDER_LEDGER = "/services/order-ledger";

    public static String topicFor(String eventType) {
        return switch (eventType) {
            case ORDER_CREATED    -> TOPIC_ORDERS_CREATED;
            case ORDER_ITEM_ADDED -> TOPIC_ORDERS_ITEM_ADDED;
            case ORDER_SHIPPED    -> TOPIC_ORDERS_SHIPPED;
            case ORDER_CANCELLED  -> TOPIC_ORDERS_CANCELLED;
            default -> throw new IllegalArgumentException("No topic mapped for event type: " + eventType);
        };
    }
}
