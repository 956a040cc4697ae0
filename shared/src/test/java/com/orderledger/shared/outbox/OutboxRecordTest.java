package com.orderledger.shared.outbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class OutboxRecordTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("recordFailure: backs off 5s, 10s, 20s, 40s, 80s")
    void recordFailure_shouldBackOffExponentially() {
        OutboxRecord record = OutboxRecord.builder().id("evt-1").build();

        long[] expected = {5, 10, 20, 40, 80};
        for (int i = 0; i < expected.length; i++) {
            record.recordFailure("broker down", NOW);
            assertThat(record.getRetryCount()).isEqualTo(i + 1);
            assertThat(record.getNextRetryAt()).isEqualTo(NOW.plusSeconds(expected[i]));
        }
        assertThat(record.getLastError()).isEqualTo("broker down");
        assertThat(record.isExhausted()).isTrue();
    }

    @Test
    @DisplayName("markPublished: clears the last error")
    void markPublished_shouldClearError() {
        OutboxRecord record = OutboxRecord.builder().id("evt-1").build();
        record.recordFailure("timeout", NOW);

        record.markPublished(NOW.plusSeconds(6));

        assertThat(record.isPublished()).isTrue();
        assertThat(record.getPublishedAt()).isEqualTo(NOW.plusSeconds(6));
        assertThat(record.getLastError()).isNull();
        assertThat(record.isExhausted()).isFalse();
    }
}
