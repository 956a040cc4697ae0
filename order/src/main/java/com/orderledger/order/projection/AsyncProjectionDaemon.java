package com.orderledger.order.projection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Catch-up daemon for async projections.
 *
 * Each poll drains every async shard up to the current end of the log, one transaction per batch.
 * Shards being rebuilt in this process are skipped; the rebuild advances them itself.
 * A failing shard is logged and retried on the next poll without holding back the others.
 */
@Slf4j
@Component
public class AsyncProjectionDaemon {

    private final ProjectionEngine engine;
    private final ProjectionStatusRegistry statusRegistry;
    private final TransactionOperations transactions;
    private final int batchSize;
    private final boolean enabled;

    public AsyncProjectionDaemon(ProjectionEngine engine,
                                 ProjectionStatusRegistry statusRegistry,
                                 TransactionOperations transactions,
                                 @Value("${orderledger.projections.batch-size:500}") int batchSize,
                                 @Value("${orderledger.projections.daemon.enabled:true}") boolean enabled) {
        this.engine = engine;
        this.statusRegistry = statusRegistry;
        this.transactions = transactions;
        this.batchSize = batchSize;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${orderledger.projections.daemon.poll-interval-ms:1000}")
    public void poll() {
        if (!enabled) return;

        for (ProjectionKind kind : engine.asyncKinds()) {
            if (statusRegistry.isRebuilding(kind)) {
                log.debug("Shard skipped, rebuild running: shard={}", kind.getShardName());
                continue;
            }
            try {
                int total = drain(kind);
                if (total > 0) {
                    log.debug("Shard caught up: shard={}, events={}", kind.getShardName(), total);
                }
            } catch (Exception e) {
                log.error("Async projection failed: shard={}", kind.getShardName(), e);
            }
        }
    }

    int drain(ProjectionKind kind) {
        int total = 0;
        int applied;
        do {
            Integer batch = transactions.execute(status -> engine.catchUpBatch(kind, batchSize));
            applied = batch != null ? batch : 0;
            total += applied;
        } while (applied == batchSize);
        return total;
    }
}
