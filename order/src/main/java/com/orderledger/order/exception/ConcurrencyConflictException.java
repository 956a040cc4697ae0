package com.orderledger.order.exception;

import lombok.Getter;

/**
 * Optimistic append failed: the stream moved past the version the command was decided against.
 * Transient; the caller may reload the aggregate and retry.
 */
@Getter
public class ConcurrencyConflictException extends OrderLedgerException {

    private final String streamId;
    private final long expectedVersion;

    public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
        super(ErrorMessages.STREAM_VERSION_CONFLICT + ": streamId=" + streamId
                + ", expected=" + expectedVersion + ", actual=" + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyConflictException(String streamId, long expectedVersion, Throwable cause) {
        super(ErrorMessages.STREAM_VERSION_CONFLICT + ": streamId=" + streamId
                + ", expected=" + expectedVersion, cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }
}
