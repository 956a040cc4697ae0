package com.orderledger.order.exception;

/**
 * Infrastructure failure while reading or writing the event log or a snapshot.
 */
public class EventStoreException extends OrderLedgerException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
