package com.orderledger.shared.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderledger.shared.events.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stages a message for delivery inside the caller's transaction.
 *
 * Nothing is sent here. The row becomes visible to {@link OutboxRelayService} only when
 * the enclosing transaction commits, and disappears with it on rollback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    /**
     * @param aggregateId   Stream id the event belongs to (used as the Kafka key)
     * @param aggregateType Aggregate type, e.g. "Order"
     * @param topic         Kafka topic to publish to
     * @param event         The domain event to publish
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxRecord append(String aggregateId, String aggregateType, String topic, DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event to JSON: " + event.getType(), e);
        }

        OutboxRecord record = OutboxRecord.builder()
                .id(event.getId())
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .eventType(event.getType())
                .topic(topic)
                .payload(payload)
                .retryCount(0)
                .build();

        outboxRepository.save(record);

        log.debug("Outbox record staged: eventId={}, type={}, aggregateId={}",
                event.getId(), event.getType(), aggregateId);
        return record;
    }
}
