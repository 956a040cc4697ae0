package com.orderledger.order.domain;

import lombok.Value;

/**
 * Outcome of a handled command. {@code eventsAppended} is 0 for a no-op.
 */
@Value
public class CommandResult {
    String orderId;
    long version;
    int eventsAppended;
}
