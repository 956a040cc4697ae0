package com.orderledger.order.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderledger.order.domain.OrderAggregate;
import com.orderledger.order.domain.OrderSnapshot;
import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.exception.EventStoreException;
import com.orderledger.order.exception.OrderNotFoundException;
import com.orderledger.order.repository.OrderSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds aggregates from their streams on every call; nothing is cached between commands.
 *
 * When snapshots are enabled, loading starts from the stored snapshot and replays only
 * the events after it. A snapshot that cannot be read is ignored and the full stream replayed.
 */
@Slf4j
@Service
public class OrderAggregateRepository {

    private final OrderEventStore eventStore;
    private final OrderSnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean snapshotsEnabled;
    private final int snapshotThreshold;

    public OrderAggregateRepository(OrderEventStore eventStore,
                                    OrderSnapshotRepository snapshotRepository,
                                    ObjectMapper objectMapper,
                                    Clock clock,
                                    @Value("${orderledger.snapshot.enabled:true}") boolean snapshotsEnabled,
                                    @Value("${orderledger.snapshot.threshold:50}") int snapshotThreshold) {
        if (snapshotThreshold <= 0) {
            throw new IllegalArgumentException("orderledger.snapshot.threshold must be positive");
        }
        this.eventStore = eventStore;
        this.snapshotRepository = snapshotRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.snapshotsEnabled = snapshotsEnabled;
        this.snapshotThreshold = snapshotThreshold;
    }

    /**
     * @throws OrderNotFoundException if the stream was never started
     */
    public OrderAggregate load(String orderId) {
        Optional<OrderAggregate> fromSnapshot = snapshotsEnabled ? readSnapshot(orderId) : Optional.empty();

        if (fromSnapshot.isPresent()) {
            OrderAggregate aggregate = fromSnapshot.get();
            List<StoredEvent> tail = eventStore.readStreamAfter(orderId, aggregate.getVersion());
            tail.forEach(e -> aggregate.apply(e.getEvent()));
            log.debug("Aggregate loaded from snapshot: orderId={}, snapshotVersion={}, replayed={}",
                    orderId, aggregate.getVersion() - tail.size(), tail.size());
            return aggregate;
        }

        List<StoredEvent> events = eventStore.readStream(orderId);
        if (events.isEmpty()) {
            throw new OrderNotFoundException(orderId);
        }
        return OrderAggregate.replay(events.stream().map(StoredEvent::getEvent).toList());
    }

    /**
     * Stores a snapshot when the append moved the stream across a multiple of the threshold.
     * Must run in the same transaction as the append.
     */
    public void maybeSnapshot(OrderAggregate aggregate, long versionBeforeAppend) {
        if (!snapshotsEnabled) return;
        if (versionBeforeAppend / snapshotThreshold == aggregate.getVersion() / snapshotThreshold) return;

        String state;
        try {
            state = objectMapper.writeValueAsString(aggregate.toSnapshot());
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize snapshot: orderId=" + aggregate.getId(), e);
        }

        snapshotRepository.save(OrderSnapshot.builder()
                .orderId(aggregate.getId())
                .version(aggregate.getVersion())
                .state(state)
                .takenAt(clock.instant())
                .build());
        log.info("Snapshot taken: orderId={}, version={}", aggregate.getId(), aggregate.getVersion());
    }

    private Optional<OrderAggregate> readSnapshot(String orderId) {
        Optional<OrderSnapshot> snapshot = snapshotRepository.findById(orderId);
        if (snapshot.isEmpty()) return Optional.empty();

        try {
            OrderAggregate.Snapshot state = objectMapper.readValue(snapshot.get().getState(), OrderAggregate.Snapshot.class);
            return Optional.of(OrderAggregate.fromSnapshot(state));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable snapshot, replaying full stream: orderId={}, version={}",
                    orderId, snapshot.get().getVersion(), e);
            return Optional.empty();
        }
    }
}
