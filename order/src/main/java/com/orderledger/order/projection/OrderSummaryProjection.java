package com.orderledger.order.projection;

import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEventVisitor;
import com.orderledger.order.domain.events.OrderEvents.OrderCancelledEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;
import com.orderledger.order.projection.model.OrderSummary;
import com.orderledger.order.service.OrderEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single-stream projection: one {@link OrderSummary} per order stream.
 *
 * Each document remembers the stream position it has applied up to, so replaying an event
 * (rebuild racing the write path, a retried daemon batch) leaves it unchanged. An event that is
 * not the next position of its document (a command writing while a rebuild is still behind on
 * that stream) first reads the missing positions back from the stream, so the document never
 * skips an event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderSummaryProjection implements Projection {

    private final DocumentStore<OrderSummary> store;
    private final OrderEventStore eventStore;

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.ORDER_SUMMARY;
    }

    @Override
    public void apply(StoredEvent stored) {
        OrderSummary current = store.load(stored.getStreamId()).orElse(null);
        long applied = current != null ? current.getVersion() : 0L;
        if (stored.getVersion() <= applied) {
            log.debug("Summary already at version: orderId={}, version={}, event={}",
                    stored.getStreamId(), applied, stored.getVersion());
            return;
        }

        List<StoredEvent> pending;
        if (stored.getVersion() == applied + 1) {
            pending = List.of(stored);
        } else {
            pending = eventStore.readStreamAfter(stored.getStreamId(), applied);
            log.debug("Summary catching up from stream: orderId={}, from={}, to={}",
                    stored.getStreamId(), applied, stored.getVersion());
        }

        OrderSummary updated = current;
        for (StoredEvent event : pending) {
            updated = event.getEvent().accept(new Folder(updated));
            if (updated == null) {
                log.warn("Summary missing for event, skipped: orderId={}, version={}, type={}",
                        event.getStreamId(), event.getVersion(), event.getEvent().getType());
                return;
            }
            updated.setVersion(event.getVersion());
            updated.setUpdatedAt(event.getEvent().getOccurredAt());
        }
        if (updated == null) {
            log.warn("Summary missing for event, skipped: orderId={}, version={}, type={}",
                    stored.getStreamId(), stored.getVersion(), stored.getEvent().getType());
            return;
        }
        store.upsert(updated.getId(), updated);
    }

    @Override
    public void reset() {
        store.deleteAll();
    }

    /** Returns the document to store, or null when there is no document to update. */
    @RequiredArgsConstructor
    private static class Folder implements OrderEventVisitor<OrderSummary> {

        private final OrderSummary current;

        @Override
        public OrderSummary visit(OrderCreatedEvent event) {
            return OrderSummary.builder()
                    .id(event.getOrderId())
                    .customerId(event.getCustomerId())
                    .description(event.getDescription())
                    .build();
        }

        @Override
        public OrderSummary visit(OrderItemAddedEvent event) {
            if (current == null) return null;
            current.setTotalItems(current.getTotalItems() + event.getQuantity());
            return current;
        }

        @Override
        public OrderSummary visit(OrderShippedEvent event) {
            if (current == null) return null;
            current.setShipped(true);
            return current;
        }

        @Override
        public OrderSummary visit(OrderCancelledEvent event) {
            if (current == null) return null;
            current.setCancelled(true);
            return current;
        }
    }
}
