package com.orderledger.order.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.orderledger.order.projection.DocumentStore;
import com.orderledger.order.projection.JpaDocumentStore;
import com.orderledger.order.projection.model.OrderSummary;
import com.orderledger.order.projection.model.OrderTimelineEntry;
import com.orderledger.order.projection.model.ProductSaleContribution;
import com.orderledger.order.projection.model.ProductSales;
import com.orderledger.order.repository.OrderSummaryRepository;
import com.orderledger.order.repository.OrderTimelineRepository;
import com.orderledger.order.repository.ProductSaleContributionRepository;
import com.orderledger.order.repository.ProductSalesRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.persistence.EntityManager;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Order Ledger Spring Configuration
 */
@Configuration
@EnableScheduling
public class OrderLedgerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    // ─── Kafka Producer ───────────────────────────────────────────────────────

    @Bean
    public ProducerFactory<String, String> producerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Idempotent producer: broker-side retries never duplicate or reorder a partition
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 1000);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "gzip");
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate() {
        return new KafkaTemplate<>(producerFactory());
    }

    // ─── Kafka Consumer ───────────────────────────────────────────────────────

    @Bean
    public ConsumerFactory<String, String> consumerFactory(
            @Value("${orderledger.subscriber.group-id:order-ledger-subscribers}") String groupId) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

        // Offsets are committed by the listener after processing
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        props.put(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, 10 * 1024 * 1024);
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 3000);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);

        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);

        // One consumer per order topic partition set
        factory.setConcurrency(3);

        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(3);
        backOff.setInitialInterval(1000L);
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(10000L);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(backOff);
        errorHandler.addNotRetryableExceptions(
                com.fasterxml.jackson.core.JsonParseException.class,
                IllegalArgumentException.class
        );
        factory.setCommonErrorHandler(errorHandler);

        return factory;
    }

    // ─── Outbox relay circuit breaker ─────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${orderledger.outbox.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${orderledger.outbox.circuit-breaker.wait-in-open-state-seconds:30}") long waitSeconds) {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .waitDurationInOpenState(Duration.ofSeconds(waitSeconds))
                .permittedNumberOfCallsInHalfOpenState(3)
                .build());
    }

    // ─── Read-model document stores ───────────────────────────────────────────

    @Bean
    public DocumentStore<OrderSummary> orderSummaryStore(OrderSummaryRepository repository,
                                                         EntityManager entityManager) {
        return new JpaDocumentStore<>(repository, entityManager, OrderSummary.class);
    }

    @Bean
    public DocumentStore<ProductSales> productSalesStore(ProductSalesRepository repository,
                                                         EntityManager entityManager) {
        return new JpaDocumentStore<>(repository, entityManager, ProductSales.class);
    }

    @Bean
    public DocumentStore<ProductSaleContribution> productSaleContributionStore(
            ProductSaleContributionRepository repository, EntityManager entityManager) {
        return new JpaDocumentStore<>(repository, entityManager, ProductSaleContribution.class);
    }

    @Bean
    public DocumentStore<OrderTimelineEntry> orderTimelineStore(OrderTimelineRepository repository,
                                                                EntityManager entityManager) {
        return new JpaDocumentStore<>(repository, entityManager, OrderTimelineEntry.class);
    }

    // ─── Projection rebuilds ──────────────────────────────────────────────────

    @Bean
    public ThreadPoolTaskExecutor projectionRebuildExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // One rebuild per projection kind at most
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.setQueueCapacity(3);
        executor.setThreadNamePrefix("projection-rebuild-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    // ─── Jackson / time ───────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
