package com.orderledger.order.exception;

/**
 * Root of every error raised by the order ledger.
 */
public abstract class OrderLedgerException extends RuntimeException {

    protected OrderLedgerException(String message) {
        super(message);
    }

    protected OrderLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
