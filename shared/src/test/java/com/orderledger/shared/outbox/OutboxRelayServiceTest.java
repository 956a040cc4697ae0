package com.orderledger.shared.outbox;

import com.orderledger.shared.kafka.EventPublisher;
import com.orderledger.shared.kafka.EventPublisher.EventPublishException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: OutboxRelayService
 *
 * Repository and Kafka publisher are mocked; the circuit breaker is real.
 */
@ExtendWith(MockitoExtension.class)
class OutboxRelayServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock OutboxRepository outboxRepository;
    @Mock EventPublisher eventPublisher;

    CircuitBreakerRegistry circuitBreakerRegistry;
    SimpleMeterRegistry meterRegistry;
    OutboxRelayService relayService;

    @BeforeEach
    void setUp() {
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        meterRegistry = new SimpleMeterRegistry();
        relayService = new OutboxRelayService(outboxRepository, eventPublisher, circuitBreakerRegistry,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC), 50);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private OutboxRecord record(String id) {
        return OutboxRecord.builder()
                .id(id)
                .aggregateId("ord-1")
                .aggregateType("Order")
                .eventType("orders.created")
                .topic("orders.created")
                .payload("{\"id\":\"" + id + "\"}")
                .build();
    }

    // ─── relay Tests ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("relay: nothing pending is a no-op")
    void relay_shouldDoNothingWhenEmpty() {
        when(outboxRepository.findUnpublishedForRelay(NOW, 50)).thenReturn(List.of());

        assertThat(relayService.relay()).isZero();

        verifyNoInteractions(eventPublisher);
        verify(outboxRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("relay: publishes keyed by aggregate id and marks records published")
    void relay_shouldPublishAndMarkPublished() {
        OutboxRecord first = record("evt-1");
        OutboxRecord second = record("evt-2");
        when(outboxRepository.findUnpublishedForRelay(NOW, 50)).thenReturn(List.of(first, second));

        int relayed = relayService.relay();

        assertThat(relayed).isEqualTo(2);
        verify(eventPublisher).publishAndWait("orders.created", "ord-1", "evt-1", "orders.created", "{\"id\":\"evt-1\"}");
        verify(eventPublisher).publishAndWait("orders.created", "ord-1", "evt-2", "orders.created", "{\"id\":\"evt-2\"}");
        assertThat(first.getPublishedAt()).isEqualTo(NOW);
        assertThat(second.getPublishedAt()).isEqualTo(NOW);
        verify(outboxRepository).saveAll(List.of(first, second));
        assertThat(meterRegistry.counter("outbox.records.relayed").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("relay: a failed send schedules a retry and the rest of the batch still goes out")
    void relay_shouldRecordFailureAndContinue() {
        OutboxRecord failing = record("evt-1");
        OutboxRecord healthy = record("evt-2");
        when(outboxRepository.findUnpublishedForRelay(NOW, 50)).thenReturn(List.of(failing, healthy));
        doThrow(new EventPublishException("timeout", new RuntimeException("timeout")))
                .when(eventPublisher).publishAndWait(any(), any(), eq("evt-1"), any(), any());

        int relayed = relayService.relay();

        assertThat(relayed).isEqualTo(1);
        assertThat(failing.isPublished()).isFalse();
        assertThat(failing.getRetryCount()).isEqualTo(1);
        assertThat(failing.getNextRetryAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(failing.getLastError()).isEqualTo("timeout");
        assertThat(healthy.isPublished()).isTrue();
        assertThat(meterRegistry.counter("outbox.relay.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("relay: open circuit leaves the batch untouched for a later round")
    void relay_shouldStopWhenCircuitOpen() {
        OutboxRecord pending = record("evt-1");
        when(outboxRepository.findUnpublishedForRelay(NOW, 50)).thenReturn(List.of(pending));
        circuitBreakerRegistry.circuitBreaker(OutboxRelayService.CIRCUIT_BREAKER_NAME).transitionToOpenState();

        int relayed = relayService.relay();

        assertThat(relayed).isZero();
        verifyNoInteractions(eventPublisher);
        assertThat(pending.isPublished()).isFalse();
        assertThat(pending.getRetryCount()).isZero();
    }
}
