package com.orderledger.order.projection;

import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEventVisitor;
import com.orderledger.order.domain.events.OrderEvents.OrderCancelledEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;
import com.orderledger.order.projection.model.ProductSaleContribution;
import com.orderledger.order.projection.model.ProductSales;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Multi-stream projection keyed by item id: every order that adds an item contributes
 * to the same {@link ProductSales} document.
 *
 * Every counted event leaves a {@link ProductSaleContribution} keyed by its event id in the
 * same transaction, and an event that already has one is skipped. The projection can therefore
 * run inline, and a rebuild may replay events that commands are applying at the same time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductSalesProjection implements Projection {

    private final DocumentStore<ProductSales> store;
    private final DocumentStore<ProductSaleContribution> contributions;
    private final Clock clock;

    @Override
    public ProjectionKind kind() {
        return ProjectionKind.PRODUCT_SALES;
    }

    @Override
    public void apply(StoredEvent stored) {
        stored.getEvent().accept(new OrderEventVisitor<Void>() {
            @Override
            public Void visit(OrderItemAddedEvent event) {
                addSale(stored, event);
                return null;
            }

            @Override
            public Void visit(OrderCreatedEvent event) {
                return null;
            }

            @Override
            public Void visit(OrderShippedEvent event) {
                return null;
            }

            @Override
            public Void visit(OrderCancelledEvent event) {
                return null;
            }
        });
    }

    @Override
    public void reset() {
        store.deleteAll();
        contributions.deleteAll();
    }

    private void addSale(StoredEvent stored, OrderItemAddedEvent event) {
        if (contributions.load(event.getId()).isPresent()) {
            log.debug("Product sale already counted: itemId={}, eventId={}", event.getItemId(), event.getId());
            return;
        }

        ProductSales sales = store.load(event.getItemId())
                .orElseGet(() -> ProductSales.builder()
                        .id(event.getItemId())
                        .productName(event.getItemName())
                        .build());

        if (isBlank(sales.getProductName())) {
            sales.setProductName(event.getItemName());
        }
        sales.setTotalQuantitySold(sales.getTotalQuantitySold() + event.getQuantity());

        Instant saleAt = saleTime(event.getOccurredAt());
        if (sales.getLastSaleAt() == null || saleAt.isAfter(sales.getLastSaleAt())) {
            sales.setLastSaleAt(saleAt);
        }

        store.upsert(sales.getId(), sales);
        contributions.upsert(event.getId(), ProductSaleContribution.builder()
                .id(event.getId())
                .itemId(event.getItemId())
                .quantity(event.getQuantity())
                .globalSequence(stored.getGlobalSequence())
                .build());
        log.debug("Product sale applied: itemId={}, quantity={}, total={}",
                event.getItemId(), event.getQuantity(), sales.getTotalQuantitySold());
    }

    /** Events carrying no timestamp (null or the epoch) count as sold now. */
    private Instant saleTime(Instant occurredAt) {
        return occurredAt == null || Instant.EPOCH.equals(occurredAt) ? clock.instant() : occurredAt;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
