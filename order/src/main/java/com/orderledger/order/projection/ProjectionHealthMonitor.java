package com.orderledger.order.projection;

import com.orderledger.order.projection.model.ProjectionProgress;
import com.orderledger.order.service.OrderEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Projection Health Monitor: self-healing control loop over async shard checkpoints.
 *
 * Every interval:
 *  1. Read the global high-water mark; skip the pass if the log is empty
 *  2. For each shard checkpoint, lag = high-water mark − checkpoint
 *  3. Lag above the threshold marks the shard LAGGING and starts a background rebuild
 *
 * Passes run on the application's {@link TaskScheduler} with a fixed delay between them.
 * The rebuild is fire-and-forget, so a long rebuild never delays the next pass.
 * Errors are contained per pass and per shard. Stopping cancels the scheduled task; a pass
 * already running checks the flag between shards.
 */
@Slf4j
@Component
public class ProjectionHealthMonitor implements SmartLifecycle {

    private final OrderEventStore eventStore;
    private final ProjectionEngine engine;
    private final ProjectionRebuildService rebuildService;
    private final ProjectionStatusRegistry statusRegistry;
    private final MeterRegistry meterRegistry;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final long lagThreshold;
    private final boolean enabled;

    private final Map<String, AtomicLong> lagGauges = new ConcurrentHashMap<>();

    private volatile boolean running;
    private ScheduledFuture<?> schedule;

    public ProjectionHealthMonitor(OrderEventStore eventStore,
                                   ProjectionEngine engine,
                                   ProjectionRebuildService rebuildService,
                                   ProjectionStatusRegistry statusRegistry,
                                   MeterRegistry meterRegistry,
                                   TaskScheduler taskScheduler,
                                   @Value("${orderledger.projections.monitor.interval-ms:30000}") long intervalMs,
                                   @Value("${orderledger.projections.monitor.lag-threshold:1000}") long lagThreshold,
                                   @Value("${orderledger.projections.monitor.enabled:true}") boolean enabled) {
        this.eventStore = eventStore;
        this.engine = engine;
        this.rebuildService = rebuildService;
        this.statusRegistry = statusRegistry;
        this.meterRegistry = meterRegistry;
        this.taskScheduler = taskScheduler;
        this.interval = Duration.ofMillis(intervalMs);
        this.lagThreshold = lagThreshold;
        this.enabled = enabled;
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public synchronized void start() {
        if (running || !enabled) return;
        running = true;
        schedule = taskScheduler.scheduleWithFixedDelay(this::checkOnce, interval);
        log.info("Projection health monitor started: interval={}, lagThreshold={}", interval, lagThreshold);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (schedule != null) {
            schedule.cancel(true);
            schedule = null;
            log.info("Projection health monitor stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ─── One pass ─────────────────────────────────────────────────────────────

    public void checkOnce() {
        long latest;
        List<ProjectionProgress> shards;
        try {
            latest = eventStore.maxGlobalSequence();
            if (latest == 0) {
                log.info("No events yet, skipping health check");
                return;
            }
            shards = engine.shardProgress();
        } catch (Exception e) {
            log.error("Error checking projection lag", e);
            return;
        }

        for (ProjectionProgress shard : shards) {
            if (schedule != null && !running) return;   // stop requested
            try {
                checkShard(shard, latest);
            } catch (Exception e) {
                log.error("Error checking shard: shard={}", shard.getShardName(), e);
            }
        }
    }

    private void checkShard(ProjectionProgress shard, long latest) {
        long lag = latest - shard.getLastSequence();
        lagGauge(shard.getShardName()).set(lag);

        Optional<ProjectionKind> kind = ProjectionKind.fromShardName(shard.getShardName());
        if (kind.isEmpty()) {
            log.warn("Unknown shard, not monitored: shard={}", shard.getShardName());
            return;
        }

        boolean lagging = lag > lagThreshold;
        statusRegistry.recordLag(kind.get(), shard.getLastSequence(), lag, lagging);

        if (lagging) {
            log.warn("Projection lagging, triggering rebuild: shard={}, lag={}", shard.getShardName(), lag);
            if (rebuildService.rebuildAsync(kind.get())) {
                log.info("Projection rebuild triggered: shard={}", shard.getShardName());
            }
        } else {
            log.info("Projection healthy: shard={}, lag={}", shard.getShardName(), lag);
        }
    }

    private AtomicLong lagGauge(String shardName) {
        return lagGauges.computeIfAbsent(shardName,
                name -> meterRegistry.gauge("projection.lag", Tags.of("shard", name), new AtomicLong()));
    }
}
