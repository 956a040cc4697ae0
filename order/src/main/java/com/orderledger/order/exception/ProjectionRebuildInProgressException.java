package com.orderledger.order.exception;

import lombok.Getter;

/**
 * A rebuild of the same projection is already running, in this process or on another instance.
 */
@Getter
public class ProjectionRebuildInProgressException extends OrderLedgerException {

    private final String projection;

    public ProjectionRebuildInProgressException(String projection) {
        super("Projection rebuild already in progress: " + projection);
        this.projection = projection;
    }
}
