package com.orderledger.shared.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Kafka producer for already-serialized outbox payloads.
 *
 * Wraps Spring's KafkaTemplate with:
 *  - Event metadata propagated as Kafka headers (event-id, event-type)
 *  - Metrics (publish rate, latency, error rate)
 *  - Structured logging with event metadata
 *
 * Messages are keyed by aggregate id, so all events of one stream land on one partition
 * and keep their stream order.
 */
@Slf4j
@Component
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final long sendTimeoutMs;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          MeterRegistry meterRegistry,
                          @Value("${orderledger.outbox.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeoutMs = sendTimeoutMs;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    public CompletableFuture<SendResult<String, String>> publish(String topic, String key, String eventId,
                                                                 String eventType, String payload) {
        Timer.Sample sample = Timer.start();

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        record.headers()
                .add(new RecordHeader("event-id", eventId.getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("event-type", eventType.getBytes(StandardCharsets.UTF_8)));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event published: topic={}, eventId={}, type={}, partition={}, offset={}",
                                topic, eventId, eventType,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                                topic, eventId, eventType, ex.getMessage(), ex);
                    }
                });
    }

    /**
     * Synchronous publish: blocks until the broker acknowledges or the send timeout elapses.
     */
    public void publishAndWait(String topic, String key, String eventId, String eventType, String payload) {
        try {
            publish(topic, key, eventId, eventType, payload).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing event: " + eventType, e);
        } catch (Exception e) {
            throw new EventPublishException("Failed to publish event synchronously: " + eventType, e);
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
