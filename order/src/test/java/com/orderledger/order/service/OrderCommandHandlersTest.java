package com.orderledger.order.service;

import com.orderledger.order.domain.AddOrderItemCommand;
import com.orderledger.order.domain.CancelOrderCommand;
import com.orderledger.order.domain.CommandResult;
import com.orderledger.order.domain.CreateOrderCommand;
import com.orderledger.order.domain.OrderAggregate;
import com.orderledger.order.domain.ShipOrderCommand;
import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;
import com.orderledger.order.exception.ConcurrencyConflictException;
import com.orderledger.order.exception.InvalidOrderCommandException;
import com.orderledger.order.exception.OrderAlreadyExistsException;
import com.orderledger.order.exception.OrderConflictException;
import com.orderledger.order.exception.OrderNotFoundException;
import com.orderledger.order.projection.ProjectionEngine;
import com.orderledger.shared.events.EventTypes;
import com.orderledger.shared.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: OrderCommandHandlers
 *
 * Event store, outbox and projections are mocked. Tests the handler flow:
 * load → decide → append → outbox → inline projections.
 */
@ExtendWith(MockitoExtension.class)
class OrderCommandHandlersTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock OrderEventStore eventStore;
    @Mock OrderAggregateRepository aggregateRepository;
    @Mock OutboxService outboxService;
    @Mock ProjectionEngine projectionEngine;

    OrderCommandHandlers handlers;

    @BeforeEach
    void setUp() {
        handlers = new OrderCommandHandlers(eventStore, aggregateRepository, outboxService, projectionEngine,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private OrderAggregate existingOrder(OrderEvent... history) {
        List<OrderEvent> events = new ArrayList<>();
        events.add(new OrderCreatedEvent("ord-1", "C1", "test", T0));
        events.addAll(List.of(history));
        return OrderAggregate.replay(events);
    }

    /** Echoes the appended events back as stored events after the expected version. */
    private void stubAppendEcho() {
        when(eventStore.append(eq("ord-1"), anyLong(), anyList())).thenAnswer(inv -> {
            long expected = inv.getArgument(1);
            List<OrderEvent> events = inv.getArgument(2);
            List<StoredEvent> stored = new ArrayList<>();
            for (OrderEvent e : events) {
                expected++;
                stored.add(new StoredEvent(100 + expected, "ord-1", expected, e));
            }
            return stored;
        });
    }

    // ─── createOrder Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("createOrder: appends at version 0, stages the outbox record and applies inline projections")
    void createOrder_shouldAppendPublishAndProject() {
        when(eventStore.streamExists("ord-1")).thenReturn(false);
        stubAppendEcho();

        CommandResult result = handlers.createOrder(CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description("test").occurredAt(T0).build());

        assertThat(result.getVersion()).isEqualTo(1);
        assertThat(result.getEventsAppended()).isEqualTo(1);

        verify(eventStore).append(eq("ord-1"), eq(0L), anyList());
        verify(outboxService).append(eq("ord-1"), eq("Order"), eq(EventTypes.TOPIC_ORDERS_CREATED),
                argThat(e -> e instanceof OrderCreatedEvent && T0.equals(e.getOccurredAt())));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StoredEvent>> inline = ArgumentCaptor.forClass(List.class);
        verify(projectionEngine).applyInline(inline.capture());
        assertThat(inline.getValue()).singleElement().extracting(StoredEvent::getVersion).isEqualTo(1L);
        verify(aggregateRepository).maybeSnapshot(any(OrderAggregate.class), eq(0L));
    }

    @Test
    @DisplayName("createOrder: existing stream is an already-exists conflict with no side effects")
    void createOrder_shouldRejectExistingStream() {
        when(eventStore.streamExists("ord-1")).thenReturn(true);

        assertThatThrownBy(() -> handlers.createOrder(CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description("test").build()))
                .isInstanceOf(OrderAlreadyExistsException.class);

        verify(eventStore, never()).append(any(), anyLong(), anyList());
        verifyNoInteractions(outboxService, projectionEngine);
    }

    @Test
    @DisplayName("createOrder: missing occurredAt is stamped from the clock")
    void createOrder_shouldStampOccurredAtFromClock() {
        when(eventStore.streamExists("ord-1")).thenReturn(false);
        stubAppendEcho();

        handlers.createOrder(CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description("test").build());

        verify(outboxService).append(any(), any(), any(), argThat(e -> NOW.equals(e.getOccurredAt())));
    }

    // ─── addItem / ship / cancel Tests ────────────────────────────────────────

    @Test
    @DisplayName("addItem: appends with the loaded version as expected version")
    void addItem_shouldAppendAtLoadedVersion() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder(
                new OrderItemAddedEvent("ord-1", "I1", "Widget", 3, T0)));
        stubAppendEcho();

        CommandResult result = handlers.addItem(AddOrderItemCommand.builder()
                .orderId("ord-1").itemId("I1").itemName("Widget").quantity(2).occurredAt(T0).build());

        assertThat(result.getVersion()).isEqualTo(3);
        verify(eventStore).append(eq("ord-1"), eq(2L), argThat(events -> events.size() == 1
                && ((OrderItemAddedEvent) events.get(0)).getQuantity() == 2));
        verify(outboxService).append(eq("ord-1"), eq("Order"), eq(EventTypes.TOPIC_ORDERS_ITEM_ADDED), any());
    }

    @Test
    @DisplayName("addItem: unknown order propagates not found")
    void addItem_shouldPropagateNotFound() {
        when(aggregateRepository.load("ord-404")).thenThrow(new OrderNotFoundException("ord-404"));

        assertThatThrownBy(() -> handlers.addItem(AddOrderItemCommand.builder()
                .orderId("ord-404").itemId("I1").itemName("Widget").quantity(1).build()))
                .isInstanceOf(OrderNotFoundException.class);
        verifyNoInteractions(eventStore, outboxService, projectionEngine);
    }

    @Test
    @DisplayName("addItem: quantity 0 fails validation before anything is appended")
    void addItem_shouldRejectZeroQuantity() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder());

        assertThatThrownBy(() -> handlers.addItem(AddOrderItemCommand.builder()
                .orderId("ord-1").itemId("I1").itemName("Widget").quantity(0).build()))
                .isInstanceOf(InvalidOrderCommandException.class);
        verifyNoInteractions(eventStore, outboxService, projectionEngine);
    }

    @Test
    @DisplayName("addItem on a shipped order: conflict propagates unchanged, nothing appended")
    void addItem_shouldRejectShippedOrder() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder(new OrderShippedEvent("ord-1", T0)));

        assertThatThrownBy(() -> handlers.addItem(AddOrderItemCommand.builder()
                .orderId("ord-1").itemId("I1").itemName("Widget").quantity(1).build()))
                .isInstanceOf(OrderConflictException.class);
        verifyNoInteractions(eventStore, outboxService, projectionEngine);
    }

    @Test
    @DisplayName("ship: stages orders.shipped")
    void ship_shouldAppendShipped() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder());
        stubAppendEcho();

        CommandResult result = handlers.ship(ShipOrderCommand.builder().orderId("ord-1").occurredAt(T0).build());

        assertThat(result.getVersion()).isEqualTo(2);
        verify(outboxService).append(eq("ord-1"), eq("Order"), eq(EventTypes.TOPIC_ORDERS_SHIPPED),
                argThat(e -> e instanceof OrderShippedEvent));
    }

    @Test
    @DisplayName("cancel after ship: cannot cancel a shipped order")
    void cancel_shouldRejectShippedOrder() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder(new OrderShippedEvent("ord-1", T0)));

        assertThatThrownBy(() -> handlers.cancel(CancelOrderCommand.builder()
                .orderId("ord-1").reason("too late").build()))
                .isInstanceOf(OrderConflictException.class)
                .hasMessage("Cannot cancel a shipped order");
        verifyNoInteractions(eventStore, outboxService, projectionEngine);
    }

    @Test
    @DisplayName("concurrency conflict on append: no outbox record, no projection update")
    void cancel_shouldPropagateConcurrencyConflict() {
        when(aggregateRepository.load("ord-1")).thenReturn(existingOrder());
        when(eventStore.append(eq("ord-1"), eq(1L), anyList()))
                .thenThrow(new ConcurrencyConflictException("ord-1", 1L, 2L));

        assertThatThrownBy(() -> handlers.cancel(CancelOrderCommand.builder()
                .orderId("ord-1").reason("duplicate").build()))
                .isInstanceOf(ConcurrencyConflictException.class);
        verifyNoInteractions(outboxService, projectionEngine);
        verify(aggregateRepository, never()).maybeSnapshot(any(), anyLong());
    }
}
