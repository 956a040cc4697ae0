package com.orderledger.order.projection;

import com.orderledger.order.domain.StoredEvent;

/**
 * A read model folded from the event log.
 */
public interface Projection {

    ProjectionKind kind();

    void apply(StoredEvent event);

    /** Deletes every document of this read model. */
    void reset();
}
