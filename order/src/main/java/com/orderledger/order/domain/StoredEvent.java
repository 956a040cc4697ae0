package com.orderledger.order.domain;

import com.orderledger.order.domain.events.OrderEvent;
import lombok.Value;

/**
 * An event as read back from the log, with its stream position and global sequence.
 */
@Value
public class StoredEvent {
    long globalSequence;
    String streamId;
    long version;
    OrderEvent event;
}
