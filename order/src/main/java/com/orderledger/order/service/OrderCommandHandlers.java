package com.orderledger.order.service;

import com.orderledger.order.domain.AddOrderItemCommand;
import com.orderledger.order.domain.CancelOrderCommand;
import com.orderledger.order.domain.CommandResult;
import com.orderledger.order.domain.CreateOrderCommand;
import com.orderledger.order.domain.OrderAggregate;
import com.orderledger.order.domain.ShipOrderCommand;
import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.exception.OrderAlreadyExistsException;
import com.orderledger.order.projection.ProjectionEngine;
import com.orderledger.shared.events.EventTypes;
import com.orderledger.shared.outbox.OutboxService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Order Command Handlers: Write Side (CQRS)
 *
 * One method per use case. Each one:
 *  1. Loads the aggregate by replaying its stream (or checks the stream is new, for create)
 *  2. Asks the aggregate for the events the command produces; its errors propagate unchanged
 *  3. Appends them with the version it loaded as the expected version
 *  4. Stages one outbox record per event
 *  5. Applies inline projections
 *
 * Steps 3 to 5 share the method's transaction: on commit the events, their outbox records
 * and the inline read models become visible together; on rollback none of them do.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class OrderCommandHandlers {

    static final String AGGREGATE_TYPE = "Order";

    private final OrderEventStore eventStore;
    private final OrderAggregateRepository aggregateRepository;
    private final OutboxService outboxService;
    private final ProjectionEngine projectionEngine;
    private final Clock clock;

    @Transactional
    public CommandResult createOrder(@Valid CreateOrderCommand cmd) {
        if (eventStore.streamExists(cmd.getOrderId())) {
            log.warn("Create rejected, stream exists: orderId={}", cmd.getOrderId());
            throw new OrderAlreadyExistsException(cmd.getOrderId());
        }

        List<OrderEvent> events = OrderAggregate.create(
                cmd.getOrderId(), cmd.getCustomerId(), cmd.getDescription(), occurredAt(cmd.getOccurredAt()));

        return appendAndPublish(new OrderAggregate(), cmd.getOrderId(), events, "CreateOrder");
    }

    @Transactional
    public CommandResult addItem(@Valid AddOrderItemCommand cmd) {
        OrderAggregate aggregate = aggregateRepository.load(cmd.getOrderId());
        List<OrderEvent> events = aggregate.addItem(
                cmd.getItemId(), cmd.getItemName(), cmd.getQuantity(), occurredAt(cmd.getOccurredAt()));

        return appendAndPublish(aggregate, cmd.getOrderId(), events, "AddOrderItem");
    }

    @Transactional
    public CommandResult ship(@Valid ShipOrderCommand cmd) {
        OrderAggregate aggregate = aggregateRepository.load(cmd.getOrderId());
        List<OrderEvent> events = aggregate.ship(occurredAt(cmd.getOccurredAt()));

        return appendAndPublish(aggregate, cmd.getOrderId(), events, "ShipOrder");
    }

    @Transactional
    public CommandResult cancel(@Valid CancelOrderCommand cmd) {
        OrderAggregate aggregate = aggregateRepository.load(cmd.getOrderId());
        List<OrderEvent> events = aggregate.cancel(cmd.getReason(), occurredAt(cmd.getOccurredAt()));

        return appendAndPublish(aggregate, cmd.getOrderId(), events, "CancelOrder");
    }

    private CommandResult appendAndPublish(OrderAggregate aggregate, String orderId,
                                           List<OrderEvent> events, String command) {
        if (events.isEmpty()) {
            log.info("Command produced no events: command={}, orderId={}", command, orderId);
            return new CommandResult(orderId, aggregate.getVersion(), 0);
        }

        long expectedVersion = aggregate.getVersion();
        List<StoredEvent> stored = eventStore.append(orderId, expectedVersion, events);
        aggregate.applyAll(events);

        for (OrderEvent event : events) {
            outboxService.append(orderId, AGGREGATE_TYPE, EventTypes.topicFor(event.getType()), event);
        }

        projectionEngine.applyInline(stored);
        aggregateRepository.maybeSnapshot(aggregate, expectedVersion);

        log.info("Events persisted: command={}, orderId={}, events={}, version={}",
                command, orderId, events.size(), aggregate.getVersion());
        return new CommandResult(orderId, aggregate.getVersion(), events.size());
    }

    private Instant occurredAt(Instant supplied) {
        return supplied != null ? supplied : clock.instant();
    }
}
