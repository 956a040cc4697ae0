package com.orderledger.order.projection;

import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.domain.events.OrderEvent;
import com.orderledger.order.service.OrderEventStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Global event log held in memory. Sequences start at 1 and have no gaps.
 *
 * An event can be given its sequence without being committed yet, see {@link #appendUncommitted};
 * readers do not see it until {@link #commitLate} is called.
 */
class FakeEventLog {

    private final List<StoredEvent> events = new ArrayList<>();
    private final Map<String, Long> streamVersions = new HashMap<>();
    private final Set<Long> uncommitted = new HashSet<>();

    synchronized StoredEvent append(OrderEvent event) {
        long version = streamVersions.merge(event.getOrderId(), 1L, Long::sum);
        StoredEvent stored = new StoredEvent(events.size() + 1, event.getOrderId(), version, event);
        events.add(stored);
        return stored;
    }

    /** Assigns the next sequence to an event whose transaction has not committed. */
    synchronized StoredEvent appendUncommitted(OrderEvent event) {
        StoredEvent stored = append(event);
        uncommitted.add(stored.getGlobalSequence());
        return stored;
    }

    synchronized void commitLate(StoredEvent stored) {
        uncommitted.remove(stored.getGlobalSequence());
    }

    synchronized List<StoredEvent> readAllAfter(long afterGlobalSequence, int batchSize) {
        return events.stream()
                .filter(this::isVisible)
                .filter(e -> e.getGlobalSequence() > afterGlobalSequence)
                .limit(batchSize)
                .toList();
    }

    synchronized List<StoredEvent> readStreamAfter(String streamId, long afterVersion) {
        return events.stream()
                .filter(this::isVisible)
                .filter(e -> e.getStreamId().equals(streamId) && e.getVersion() > afterVersion)
                .toList();
    }

    synchronized long maxGlobalSequence() {
        return events.stream()
                .filter(this::isVisible)
                .mapToLong(StoredEvent::getGlobalSequence)
                .max()
                .orElse(0L);
    }

    private boolean isVisible(StoredEvent event) {
        return !uncommitted.contains(event.getGlobalSequence());
    }

    /** An event store whose reads are answered from this log. */
    OrderEventStore asEventStore() {
        OrderEventStore store = mock(OrderEventStore.class);
        lenient().when(store.readAllAfter(anyLong(), anyInt()))
                .thenAnswer(inv -> readAllAfter(inv.<Long>getArgument(0), inv.<Integer>getArgument(1)));
        lenient().when(store.readStreamAfter(anyString(), anyLong()))
                .thenAnswer(inv -> readStreamAfter(inv.<String>getArgument(0), inv.<Long>getArgument(1)));
        lenient().when(store.maxGlobalSequence()).thenAnswer(inv -> maxGlobalSequence());
        return store;
    }
}
