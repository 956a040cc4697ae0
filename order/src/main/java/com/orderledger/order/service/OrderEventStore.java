package com.orderledger.order.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderledger.order.domain.EventSequence;
import com.orderledger.order.domain.OrderEventRecord;
import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.domain.events.OrderEvents;
import com.orderledger.order.exception.ConcurrencyConflictException;
import com.orderledger.order.exception.EventStoreException;
import com.orderledger.order.repository.EventSequenceRepository;
import com.orderledger.order.repository.OrderEventRecordRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Order Event Store Service
 *
 * Append and read primitives over the {@code order_events} log.
 * Appends are optimistic: the caller states the stream version its decision was based on,
 * and the append is rejected if the stream has moved on.
 *
 * Global sequences come from the {@link EventSequence} counter, locked until the append commits.
 * Appends therefore commit in global-sequence order: a reader that sees sequence N has already
 * been able to see every sequence below it.
 */
@Slf4j
@Service
public class OrderEventStore {

    private final OrderEventRecordRepository repository;
    private final EventSequenceRepository sequenceRepository;
    private final ObjectMapper objectMapper;
    private final Counter appendedCounter;
    private final Counter conflictCounter;

    public OrderEventStore(OrderEventRecordRepository repository, EventSequenceRepository sequenceRepository,
                           ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.sequenceRepository = sequenceRepository;
        this.objectMapper = objectMapper;
        this.appendedCounter = Counter.builder("eventstore.events.appended")
                .description("Events appended to order streams")
                .register(meterRegistry);
        this.conflictCounter = Counter.builder("eventstore.concurrency.conflicts")
                .description("Appends rejected by the expected-version check")
                .register(meterRegistry);
    }

    /**
     * Append events to a stream at positions expectedVersion + 1, + 2, ...
     * Must be called within an active @Transactional context.
     *
     * @param expectedVersion version the caller loaded; 0 starts a new stream
     * @return the stored events, carrying their assigned positions and global sequences
     * @throws ConcurrencyConflictException if the stream version differs from expectedVersion,
     *                                      or a concurrent writer stored the same position first
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<StoredEvent> append(String streamId, long expectedVersion, List<? extends OrderEvent> events) {
        if (events.isEmpty()) return List.of();

        // Lock first: once held, every earlier append has committed and the version read below is current
        EventSequence globalSequence = lockGlobalSequence();

        long actualVersion = repository.findMaxSequenceByOrderId(streamId);
        if (actualVersion != expectedVersion) {
            conflictCounter.increment();
            throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
        }

        List<OrderEventRecord> records = new ArrayList<>(events.size());
        long position = expectedVersion;
        long next = globalSequence.allocate(events.size());
        for (OrderEvent event : events) {
            records.add(OrderEventRecord.builder()
                    .globalSequence(next++)
                    .eventId(event.getId())
                    .orderId(streamId)
                    .sequence(++position)
                    .eventType(event.getType())
                    .payload(serialize(event))
                    .occurredAt(event.getOccurredAt())
                    .build());
        }

        List<OrderEventRecord> saved;
        try {
            sequenceRepository.save(globalSequence);
            saved = repository.saveAllAndFlush(records);
        } catch (DataIntegrityViolationException e) {
            conflictCounter.increment();
            throw new ConcurrencyConflictException(streamId, expectedVersion, e);
        }

        appendedCounter.increment(saved.size());
        log.debug("Events appended: streamId={}, fromVersion={}, toVersion={}",
                streamId, expectedVersion, position);

        List<StoredEvent> stored = new ArrayList<>(saved.size());
        for (int i = 0; i < saved.size(); i++) {
            OrderEventRecord record = saved.get(i);
            stored.add(new StoredEvent(record.getGlobalSequence(), streamId, record.getSequence(), events.get(i)));
        }
        return stored;
    }

    private EventSequence lockGlobalSequence() {
        return sequenceRepository.findForUpdate(EventSequence.ORDER_EVENTS)
                .orElseGet(() -> {
                    sequenceRepository.createIfAbsent(EventSequence.ORDER_EVENTS);
                    return sequenceRepository.findForUpdate(EventSequence.ORDER_EVENTS)
                            .orElseThrow(() -> new EventStoreException(
                                    "Global sequence counter missing: " + EventSequence.ORDER_EVENTS));
                });
    }

    /**
     * All events of a stream in position order; empty if the stream was never started.
     */
    public List<StoredEvent> readStream(String streamId) {
        return toStored(repository.findByOrderIdOrderBySequenceAsc(streamId));
    }

    public List<StoredEvent> readStreamAfter(String streamId, long afterVersion) {
        return toStored(repository.findByOrderIdAndSequenceGreaterThanOrderBySequenceAsc(streamId, afterVersion));
    }

    public long streamVersion(String streamId) {
        return repository.findMaxSequenceByOrderId(streamId);
    }

    public boolean streamExists(String streamId) {
        return repository.existsByOrderId(streamId);
    }

    /**
     * Global high-water mark; 0 when the log is empty.
     */
    public long maxGlobalSequence() {
        return repository.findMaxGlobalSequence();
    }

    /**
     * Next batch of the global log, across all streams, in global order.
     */
    public List<StoredEvent> readAllAfter(long afterGlobalSequence, int batchSize) {
        return toStored(repository.findByGlobalSequenceGreaterThanOrderByGlobalSequenceAsc(
                afterGlobalSequence, PageRequest.of(0, batchSize)));
    }

    private List<StoredEvent> toStored(List<OrderEventRecord> records) {
        return records.stream()
                .map(r -> new StoredEvent(r.getGlobalSequence(), r.getOrderId(), r.getSequence(), deserialize(r)))
                .toList();
    }

    private String serialize(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize event for event store: " + event.getType(), e);
        }
    }

    private OrderEvent deserialize(OrderEventRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), OrderEvents.classFor(record.getEventType()));
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to read stored event: globalSequence="
                    + record.getGlobalSequence() + ", type=" + record.getEventType(), e);
        }
    }
}
