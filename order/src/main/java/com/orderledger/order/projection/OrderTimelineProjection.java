package com.orderledger.order.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.exception.EventStoreException;
import com.orderledger.order.projection.model.OrderTimelineEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Event-log projection: one timeline row per event, keyed by event id.
 * No merge logic, so reapplying an event rewrites the same row.
 */
@Component
@RequiredArgsConstructor
public class OrderTimelineProjection implements Projection {

    private final DocumentStore<OrderTimelineEntry> store;
    private final ObjectMapper objectMapper;

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.ORDER_TIMELINE;
    }

    @Override
    public void apply(StoredEvent stored) {
        OrderEvent event = stored.getEvent();
        OrderTimelineEntry entry = OrderTimelineEntry.builder()
                .id(event.getId())
                .orderId(stored.getStreamId())
                .eventType(event.getType())
                .payload(toJson(event))
                .occurredAt(event.getOccurredAt())
                .globalSequence(stored.getGlobalSequence())
                .build();
        store.upsert(entry.getId(), entry);
    }

    @Override
    public void reset() {
        store.deleteAll();
    }

    private String toJson(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize timeline payload: " + event.getId(), e);
        }
    }
}
