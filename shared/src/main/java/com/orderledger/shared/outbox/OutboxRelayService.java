package com.orderledger.shared.outbox;

import com.orderledger.shared.kafka.EventPublisher;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Outbox Relay: polls committed outbox rows and forwards them to Kafka.
 *
 * Runs one second after the previous round completes and processes up to one batch per round.
 * A crash between the Kafka ack and the commit of {@code published_at} leaves the row
 * unpublished, so it is sent again on the next round (at-least-once).
 *
 * Sends go through the "outbox-relay" circuit breaker. Once it opens, the rest of the batch
 * is left untouched for a later round instead of burning retry attempts against a dead broker.
 */
@Slf4j
@Service
public class OutboxRelayService {

    public static final String CIRCUIT_BREAKER_NAME = "outbox-relay";

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final int batchSize;

    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository,
                              EventPublisher eventPublisher,
                              CircuitBreakerRegistry circuitBreakerRegistry,
                              MeterRegistry meterRegistry,
                              Clock clock,
                              @Value("${orderledger.outbox.batch-size:50}") int batchSize) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.clock = clock;
        this.batchSize = batchSize;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${orderledger.outbox.poll-interval-ms:1000}")
    @Transactional
    public int relay() {
        List<OutboxRecord> records = outboxRepository.findUnpublishedForRelay(clock.instant(), batchSize);

        if (records.isEmpty()) return 0;

        log.debug("Outbox relay: processing {} records", records.size());

        int relayed = 0;
        for (OutboxRecord record : records) {
            try {
                circuitBreaker.executeRunnable(() -> eventPublisher.publishAndWait(
                        record.getTopic(), record.getAggregateId(), record.getId(),
                        record.getEventType(), record.getPayload()));
                record.markPublished(clock.instant());
                relayedCounter.increment();
                relayed++;
            } catch (CallNotPermittedException ex) {
                log.warn("Outbox relay paused, circuit breaker open: remaining={}", records.size() - relayed);
                break;
            } catch (Exception ex) {
                Instant now = clock.instant();
                record.recordFailure(ex.getMessage(), now);
                relayErrorCounter.increment();
                log.error("Failed to relay outbox record: id={}, eventType={}, attempt={}, nextRetryAt={}",
                        record.getId(), record.getEventType(), record.getRetryCount(), record.getNextRetryAt(), ex);
                if (record.isExhausted()) {
                    log.error("Outbox record exhausted retries and will not be relayed again: id={}, aggregateId={}",
                            record.getId(), record.getAggregateId());
                }
            }
        }

        outboxRepository.saveAll(records);
        return relayed;
    }
}
