package com.orderledger.order.exception;

/**
 * Error messages shared by the aggregate, the command handlers and the event store.
 */
public final class ErrorMessages {

    private ErrorMessages() {}

    // Order state
    public static final String ORDER_ALREADY_SHIPPED = "Cannot modify order - already shipped";
    public static final String ORDER_CANCELLED = "Cannot modify order - already cancelled";
    public static final String ORDER_ALREADY_EXISTS = "Order already exists";
    public static final String ORDER_NOT_FOUND = "Order not found";
    public static final String CANNOT_CANCEL_SHIPPED_ORDER = "Cannot cancel a shipped order";
    public static final String ORDER_ALREADY_CANCELLED = "Order is already cancelled";

    // Validation
    public static final String INVALID_QUANTITY = "Quantity must be greater than zero";
    public static final String INVALID_DESCRIPTION = "Description cannot be empty";
    public static final String INVALID_ITEM_NAME = "Item name cannot be empty";
    public static final String INVALID_CANCELLATION_REASON = "Cancellation reason is required";

    // Concurrency
    public static final String STREAM_VERSION_CONFLICT = "Stream was modified concurrently";
}
