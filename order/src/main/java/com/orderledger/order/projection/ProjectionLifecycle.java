package com.orderledger.order.projection;

public enum ProjectionLifecycle {
    /** Applied in the command transaction */
    INLINE,
    /** Applied by the catch-up daemon, tracked by a progress row */
    ASYNC
}
