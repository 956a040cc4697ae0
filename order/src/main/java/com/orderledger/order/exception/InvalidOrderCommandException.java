package com.orderledger.order.exception;

/**
 * Malformed command input. Raised before any state change; a client error.
 */
public class InvalidOrderCommandException extends OrderLedgerException {

    public InvalidOrderCommandException(String message) {
        super(message);
    }
}
