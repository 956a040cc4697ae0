package com.orderledger.order.exception;

import lombok.Getter;

/**
 * The command is not allowed in the order's current state (shipped, cancelled, already created).
 */
@Getter
public class OrderConflictException extends OrderLedgerException {

    private final String orderId;

    public OrderConflictException(String orderId, String message) {
        super(message);
        this.orderId = orderId;
    }
}
