package com.orderledger.shared.outbox;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes published outbox rows past their retention period.
 * Unpublished and exhausted rows are kept for inspection.
 */
@Slf4j
@Service
public class OutboxCleanupService {

    private final OutboxRepository outboxRepository;
    private final Clock clock;
    private final boolean enabled;
    private final Duration retention;

    public OutboxCleanupService(OutboxRepository outboxRepository,
                                Clock clock,
                                @Value("${orderledger.outbox.cleanup.enabled:true}") boolean enabled,
                                @Value("${orderledger.outbox.cleanup.retention-days:7}") int retentionDays) {
        this.outboxRepository = outboxRepository;
        this.clock = clock;
        this.enabled = enabled;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Scheduled(cron = "${orderledger.outbox.cleanup.cron:0 0 2 * * ?}")
    @Transactional
    public int purgePublished() {
        if (!enabled) {
            log.debug("Outbox cleanup disabled, skipping");
            return 0;
        }

        Instant cutoff = clock.instant().minus(retention);
        int deleted = outboxRepository.deletePublishedBefore(cutoff);
        log.info("Outbox cleanup completed: deleted={}, cutoff={}", deleted, cutoff);
        return deleted;
    }
}
