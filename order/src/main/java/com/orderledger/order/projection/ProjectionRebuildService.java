package com.orderledger.order.projection;

import com.orderledger.order.exception.ProjectionRebuildInProgressException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Projection rebuild: recompute a read model from the full event log.
 *
 * Flow:
 *  1. Claim the projection locally (status REBUILDING) and cluster-wide (Redis lease)
 *  2. Reset: delete the documents and, for async shards, rewind the checkpoint
 *  3. Replay the log in global order, one transaction per batch
 *  4. Stop when a batch comes back empty, which also picks up events appended during the replay
 *
 * The write path is never paused. Queries may see a partially rebuilt read model until step 4 ends.
 * Rebuilding twice converges to the same documents.
 */
@Slf4j
@Service
public class ProjectionRebuildService {

    private final ProjectionEngine engine;
    private final ProjectionStatusRegistry statusRegistry;
    private final ProjectionRebuildLease lease;
    private final TransactionOperations transactions;
    private final Executor rebuildExecutor;
    private final int batchSize;
    private final MeterRegistry meterRegistry;

    public ProjectionRebuildService(ProjectionEngine engine,
                                    ProjectionStatusRegistry statusRegistry,
                                    ProjectionRebuildLease lease,
                                    TransactionOperations transactions,
                                    @Qualifier("projectionRebuildExecutor") Executor rebuildExecutor,
                                    MeterRegistry meterRegistry,
                                    @Value("${orderledger.projections.batch-size:500}") int batchSize) {
        this.engine = engine;
        this.statusRegistry = statusRegistry;
        this.lease = lease;
        this.transactions = transactions;
        this.rebuildExecutor = rebuildExecutor;
        this.meterRegistry = meterRegistry;
        this.batchSize = batchSize;
    }

    /**
     * Rebuilds on the calling thread.
     *
     * @return the global sequence the rebuilt projection is current to
     * @throws ProjectionRebuildInProgressException if the projection is already being rebuilt
     */
    public long rebuild(ProjectionKind kind) {
        claim(kind);
        return runClaimed(kind);
    }

    /**
     * Fire-and-forget rebuild on the rebuild executor.
     *
     * @return false if a rebuild of this projection is already running
     */
    public boolean rebuildAsync(ProjectionKind kind) {
        try {
            claim(kind);
        } catch (ProjectionRebuildInProgressException e) {
            log.info("Rebuild not started, already running: projection={}", kind.getIdentifier());
            return false;
        }

        try {
            rebuildExecutor.execute(() -> {
                try {
                    runClaimed(kind);
                } catch (Exception e) {
                    log.error("Background rebuild failed: projection={}", kind.getIdentifier(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            release(kind, "Rebuild rejected by executor: " + e.getMessage());
            throw e;
        }
        return true;
    }

    private void claim(ProjectionKind kind) {
        ShardState previous = statusRegistry.get(kind).getState();
        if (!statusRegistry.tryStartRebuild(kind)) {
            throw new ProjectionRebuildInProgressException(kind.getIdentifier());
        }
        boolean leased;
        try {
            leased = lease.acquire(kind);
        } catch (RuntimeException e) {
            statusRegistry.abandonRebuild(kind, previous);
            throw e;
        }
        if (!leased) {
            statusRegistry.abandonRebuild(kind, previous);
            throw new ProjectionRebuildInProgressException(kind.getIdentifier());
        }
    }

    private long runClaimed(ProjectionKind kind) {
        log.info("Projection rebuild started: projection={}, lifecycle={}", kind.getIdentifier(), engine.lifecycle(kind));
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            transactions.executeWithoutResult(status -> engine.reset(kind));

            long position = engine.isAsync(kind) ? replayThroughCheckpoint(kind) : replayFromStart(kind);

            statusRegistry.completeRebuild(kind, position);
            rebuildCounter(kind, "success").increment();
            log.info("Projection rebuild completed: projection={}, lastSequence={}", kind.getIdentifier(), position);
            return position;
        } catch (RuntimeException e) {
            statusRegistry.failRebuild(kind, e.getMessage());
            rebuildCounter(kind, "failure").increment();
            log.error("Projection rebuild failed: projection={}", kind.getIdentifier(), e);
            throw e;
        } finally {
            sample.stop(Timer.builder("projection.rebuild.duration")
                    .tag("projection", kind.getIdentifier())
                    .register(meterRegistry));
            lease.release(kind);
        }
    }

    /** Async shards rebuild by catching up their rewound checkpoint. */
    private long replayThroughCheckpoint(ProjectionKind kind) {
        long replayed = 0;
        int applied;
        do {
            Integer batch = transactions.execute(status -> engine.catchUpBatch(kind, batchSize));
            applied = batch != null ? batch : 0;
            replayed += applied;
            if (applied > 0) {
                lease.renew(kind);
                log.debug("Rebuild progress: projection={}, replayed={}", kind.getIdentifier(), replayed);
            }
        } while (applied > 0);
        return engine.checkpoint(kind);
    }

    /** Inline projections have no checkpoint; the cursor lives on this thread. */
    private long replayFromStart(ProjectionKind kind) {
        long cursor = 0;
        while (true) {
            long from = cursor;
            Long next = transactions.execute(status -> engine.replayBatch(kind, from, batchSize));
            if (next == null || next == from) return cursor;
            cursor = next;
            lease.renew(kind);
            log.debug("Rebuild progress: projection={}, position={}", kind.getIdentifier(), cursor);
        }
    }

    private void release(ProjectionKind kind, String error) {
        statusRegistry.failRebuild(kind, error);
        lease.release(kind);
    }

    private Counter rebuildCounter(ProjectionKind kind, String outcome) {
        return Counter.builder("projection.rebuilds")
                .tag("projection", kind.getIdentifier())
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
