package com.orderledger.order.projection;

/**
 * HEALTHY → LAGGING (lag over threshold) → REBUILDING → HEALTHY
 */
public enum ShardState {
    HEALTHY,
    LAGGING,
    REBUILDING
}
