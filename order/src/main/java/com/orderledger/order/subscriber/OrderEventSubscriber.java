package com.orderledger.order.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.domain.events.OrderEventVisitor;
import com.orderledger.order.domain.events.OrderEvents;
import com.orderledger.order.domain.events.OrderEvents.OrderCancelledEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderShippedEvent;
import com.orderledger.shared.events.EventTypes;
import com.orderledger.shared.kafka.IdempotencyService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Downstream subscriber for the order events the outbox relay publishes.
 *
 * Every delivery is deduplicated by its event-id header, typed by its event-type header,
 * logged, and acknowledged only after it was handled. A failed delivery gives up its
 * deduplication claim and is left to the container's retry policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventSubscriber {

    static final String HEADER_EVENT_ID = "event-id";
    static final String HEADER_EVENT_TYPE = "event-type";

    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            id = "order-event-subscriber",
            topics = {
                    EventTypes.TOPIC_ORDERS_CREATED,
                    EventTypes.TOPIC_ORDERS_ITEM_ADDED,
                    EventTypes.TOPIC_ORDERS_SHIPPED,
                    EventTypes.TOPIC_ORDERS_CANCELLED
            },
            groupId = "${orderledger.subscriber.group-id:order-ledger-subscribers}",
            autoStartup = "${orderledger.subscriber.enabled:true}")
    public void onOrderEvent(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String eventId = header(record, HEADER_EVENT_ID);
        if (eventId == null || idempotencyService.isDuplicate(eventId, record.topic())) {
            ack.acknowledge();
            return;
        }

        try {
            String eventType = header(record, HEADER_EVENT_TYPE);
            OrderEvent event = objectMapper.readValue(record.value(),
                    OrderEvents.classFor(eventType != null ? eventType : record.topic()));
            event.accept(new EventLogger());
            meterRegistry.counter("subscriber.events.received", "type", event.getType()).increment();
            ack.acknowledge();
        } catch (Exception ex) {
            idempotencyService.release(eventId, record.topic());
            log.error("Order event handling failed: eventId={}, topic={}, offset={}",
                    eventId, record.topic(), record.offset(), ex);
            throw new RuntimeException(ex);
        }
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    private static class EventLogger implements OrderEventVisitor<Void> {

        @Override
        public Void visit(OrderCreatedEvent event) {
            log.info("Order created: orderId={}, customerId={}", event.getOrderId(), event.getCustomerId());
            return null;
        }

        @Override
        public Void visit(OrderItemAddedEvent event) {
            log.info("Item added: {} x{} on order {}", event.getItemName(), event.getQuantity(), event.getOrderId());
            return null;
        }

        @Override
        public Void visit(OrderShippedEvent event) {
            log.info("Order shipped: orderId={}, at={}", event.getOrderId(), event.getOccurredAt());
            return null;
        }

        @Override
        public Void visit(OrderCancelledEvent event) {
            log.info("Order cancelled: orderId={}, reason={}", event.getOrderId(), event.getReason());
            return null;
        }
    }
}
