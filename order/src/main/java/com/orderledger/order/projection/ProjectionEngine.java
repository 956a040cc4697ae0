package com.orderledger.order.projection;

import com.orderledger.order.domain.StoredEvent;
import com.orderledger.order.projection.model.ProjectionGuard;
import com.orderledger.order.projection.model.ProjectionProgress;
import com.orderledger.order.repository.ProjectionGuardRepository;
import com.orderledger.order.repository.ProjectionProgressRepository;
import com.orderledger.order.service.OrderEventStore;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes events to projections according to their lifecycle.
 *
 * Inline projections are applied from the command transaction. Async projections are advanced
 * in batches from the global log, and their checkpoint moves in the same transaction as the
 * documents it covers. None of the methods here open transactions; callers do.
 *
 * An async shard only advances over a contiguous run of global sequences. If the log shows a
 * hole after the checkpoint, the shard waits for it to fill; a hole still open after the gap
 * timeout is skipped with a warning.
 *
 * Inline writes take their projection's guard row shared, a reset of an inline projection takes
 * it exclusively, so a command never updates a document a concurrent reset is deleting.
 */
@Slf4j
@Component
public class ProjectionEngine {

    private final Map<ProjectionKind, Projection> projections = new EnumMap<>(ProjectionKind.class);
    private final Map<ProjectionKind, ProjectionLifecycle> lifecycles = new EnumMap<>(ProjectionKind.class);
    private final OrderEventStore eventStore;
    private final ProjectionProgressRepository progressRepository;
    private final ProjectionGuardRepository guardRepository;
    private final Clock clock;
    private final Duration gapTimeout;
    private final Map<ProjectionKind, PendingGap> gaps = new ConcurrentHashMap<>();

    public ProjectionEngine(List<Projection> projections,
                            OrderEventStore eventStore,
                            ProjectionProgressRepository progressRepository,
                            ProjectionGuardRepository guardRepository,
                            Clock clock,
                            @Value("${orderledger.projections.order-summary.lifecycle:INLINE}") ProjectionLifecycle orderSummary,
                            @Value("${orderledger.projections.product-sales.lifecycle:ASYNC}") ProjectionLifecycle productSales,
                            @Value("${orderledger.projections.order-timeline.lifecycle:INLINE}") ProjectionLifecycle orderTimeline,
                            @Value("${orderledger.projections.gap-timeout-ms:10000}") long gapTimeoutMs) {
        projections.forEach(p -> this.projections.put(p.kind(), p));
        for (ProjectionKind kind : ProjectionKind.values()) {
            if (!this.projections.containsKey(kind)) {
                throw new IllegalStateException("No projection registered for " + kind.getIdentifier());
            }
        }
        this.eventStore = eventStore;
        this.progressRepository = progressRepository;
        this.guardRepository = guardRepository;
        this.clock = clock;
        this.gapTimeout = Duration.ofMillis(gapTimeoutMs);
        this.lifecycles.put(ProjectionKind.ORDER_SUMMARY, orderSummary);
        this.lifecycles.put(ProjectionKind.PRODUCT_SALES, productSales);
        this.lifecycles.put(ProjectionKind.ORDER_TIMELINE, orderTimeline);
        log.info("Projection lifecycles: {}", lifecycles);
    }

    /**
     * Applies freshly appended events to every inline projection, in the command transaction.
     */
    public void applyInline(List<StoredEvent> events) {
        lifecycles.forEach((kind, lifecycle) -> {
            if (lifecycle != ProjectionLifecycle.INLINE) return;
            lockGuard(kind, false);
            Projection projection = projections.get(kind);
            events.forEach(projection::apply);
        });
    }

    public ProjectionLifecycle lifecycle(ProjectionKind kind) {
        return lifecycles.get(kind);
    }

    public boolean isAsync(ProjectionKind kind) {
        return lifecycles.get(kind) == ProjectionLifecycle.ASYNC;
    }

    public List<ProjectionKind> asyncKinds() {
        return Arrays.stream(ProjectionKind.values()).filter(this::isAsync).toList();
    }

    /**
     * Processes the next batch of an async shard after its checkpoint, holding the checkpoint's
     * row lock, and advances the checkpoint to the last applied sequence. Stops in front of an
     * open sequence gap.
     *
     * @return number of events applied; 0 when the shard is caught up or waiting on a gap
     */
    public int catchUpBatch(ProjectionKind kind, int batchSize) {
        ProjectionProgress progress = lockProgress(kind);
        List<StoredEvent> batch = contiguousRun(kind, progress.getLastSequence(),
                eventStore.readAllAfter(progress.getLastSequence(), batchSize));
        if (batch.isEmpty()) return 0;

        Projection projection = projections.get(kind);
        batch.forEach(projection::apply);

        progress.advanceTo(batch.get(batch.size() - 1).getGlobalSequence(), clock.instant());
        progressRepository.save(progress);
        log.debug("Shard advanced: shard={}, events={}, lastSequence={}",
                kind.getShardName(), batch.size(), progress.getLastSequence());
        return batch.size();
    }

    /**
     * Replays one batch into a projection without touching any checkpoint.
     *
     * @return the global sequence of the last replayed event, or {@code afterSequence} if none
     */
    public long replayBatch(ProjectionKind kind, long afterSequence, int batchSize) {
        List<StoredEvent> batch = eventStore.readAllAfter(afterSequence, batchSize);
        if (batch.isEmpty()) return afterSequence;

        Projection projection = projections.get(kind);
        batch.forEach(projection::apply);
        return batch.get(batch.size() - 1).getGlobalSequence();
    }

    /**
     * Deletes the projection's documents and, for async shards, rewinds the checkpoint to 0.
     */
    public void reset(ProjectionKind kind) {
        if (isAsync(kind)) {
            ProjectionProgress progress = lockProgress(kind);
            projections.get(kind).reset();
            progress.reset(clock.instant());
            progressRepository.save(progress);
            gaps.remove(kind);
        } else {
            lockGuard(kind, true);
            projections.get(kind).reset();
        }
        log.info("Projection reset: projection={}", kind.getIdentifier());
    }

    public long checkpoint(ProjectionKind kind) {
        return progressRepository.findById(kind.getShardName())
                .map(ProjectionProgress::getLastSequence)
                .orElse(0L);
    }

    public List<ProjectionProgress> shardProgress() {
        return progressRepository.findAll();
    }

    /**
     * Longest prefix of {@code batch} that continues {@code checkpoint} without a hole, except
     * that a hole open for longer than the gap timeout is stepped over.
     */
    private List<StoredEvent> contiguousRun(ProjectionKind kind, long checkpoint, List<StoredEvent> batch) {
        long expected = checkpoint + 1;
        for (int i = 0; i < batch.size(); i++) {
            long sequence = batch.get(i).getGlobalSequence();
            if (sequence != expected && !gapExpired(kind, expected, sequence)) {
                return batch.subList(0, i);
            }
            expected = sequence + 1;
        }
        gaps.remove(kind);
        return batch;
    }

    private boolean gapExpired(ProjectionKind kind, long missing, long next) {
        Instant now = clock.instant();
        PendingGap gap = gaps.compute(kind, (k, current) ->
                current != null && current.getMissing() == missing ? current : new PendingGap(missing, now));
        if (Duration.between(gap.getFirstSeenAt(), now).compareTo(gapTimeout) < 0) {
            log.debug("Shard waiting on sequence gap: shard={}, missing={}, next={}",
                    kind.getShardName(), missing, next);
            return false;
        }
        log.warn("Skipping sequence gap: shard={}, missing={}..{}, openSince={}",
                kind.getShardName(), missing, next - 1, gap.getFirstSeenAt());
        gaps.remove(kind);
        return true;
    }

    private void lockGuard(ProjectionKind kind, boolean exclusive) {
        String id = kind.getIdentifier();
        Optional<ProjectionGuard> guard = exclusive ? guardRepository.lockExclusive(id) : guardRepository.lockShared(id);
        if (guard.isEmpty()) {
            guardRepository.createIfAbsent(id);
            if (exclusive) guardRepository.lockExclusive(id);
            else guardRepository.lockShared(id);
        }
    }

    private ProjectionProgress lockProgress(ProjectionKind kind) {
        return progressRepository.findForUpdate(kind.getShardName())
                .orElseGet(() -> progressRepository.saveAndFlush(ProjectionProgress.builder()
                        .shardName(kind.getShardName())
                        .lastSequence(0L)
                        .updatedAt(clock.instant())
                        .build()));
    }

    @Getter
    @RequiredArgsConstructor
    private static final class PendingGap {
        private final long missing;
        private final Instant firstSeenAt;
    }
}
