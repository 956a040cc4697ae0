package com.orderledger.order.projection;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process view of each projection's health, fed by the health monitor and the rebuild service.
 * A projection reports HEALTHY until something says otherwise.
 */
@Component
@RequiredArgsConstructor
public class ProjectionStatusRegistry {

    private final Map<ProjectionKind, ProjectionStatus> statuses = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProjectionStatus get(ProjectionKind kind) {
        return statuses.getOrDefault(kind, initial(kind));
    }

    public List<ProjectionStatus> all() {
        return Arrays.stream(ProjectionKind.values()).map(this::get).toList();
    }

    public boolean isRebuilding(ProjectionKind kind) {
        return get(kind).getState() == ShardState.REBUILDING;
    }

    /**
     * Records a lag measurement. A rebuilding projection stays REBUILDING until the rebuild ends.
     */
    public void recordLag(ProjectionKind kind, long lastSequence, long lag, boolean overThreshold) {
        statuses.compute(kind, (k, current) -> {
            ProjectionStatus base = current != null ? current : initial(k);
            ShardState state = base.getState() == ShardState.REBUILDING ? ShardState.REBUILDING
                    : overThreshold ? ShardState.LAGGING : ShardState.HEALTHY;
            return base.toBuilder()
                    .state(state)
                    .lastSequence(lastSequence)
                    .lag(lag)
                    .lastCheckedAt(clock.instant())
                    .build();
        });
    }

    /**
     * @return false if a rebuild of this projection is already running in this process
     */
    public boolean tryStartRebuild(ProjectionKind kind) {
        AtomicBoolean started = new AtomicBoolean(false);
        statuses.compute(kind, (k, current) -> {
            ProjectionStatus base = current != null ? current : initial(k);
            if (base.getState() == ShardState.REBUILDING) return base;
            started.set(true);
            return base.toBuilder()
                    .state(ShardState.REBUILDING)
                    .lastRebuildStartedAt(clock.instant())
                    .lastError(null)
                    .build();
        });
        return started.get();
    }

    public void completeRebuild(ProjectionKind kind, long lastSequence) {
        statuses.compute(kind, (k, current) -> (current != null ? current : initial(k)).toBuilder()
                .state(ShardState.HEALTHY)
                .lastSequence(lastSequence)
                .lag(0L)
                .lastRebuildCompletedAt(clock.instant())
                .build());
    }

    /** The projection returns to LAGGING so the next monitor pass can retry. */
    public void failRebuild(ProjectionKind kind, String error) {
        statuses.compute(kind, (k, current) -> (current != null ? current : initial(k)).toBuilder()
                .state(ShardState.LAGGING)
                .lastError(error)
                .build());
    }

    /** Releases a rebuild slot that was taken but never started. */
    public void abandonRebuild(ProjectionKind kind, ShardState previous) {
        statuses.computeIfPresent(kind, (k, current) -> current.toBuilder().state(previous).build());
    }

    private static ProjectionStatus initial(ProjectionKind kind) {
        return ProjectionStatus.builder()
                .kind(kind)
                .state(ShardState.HEALTHY)
                .build();
    }
}
