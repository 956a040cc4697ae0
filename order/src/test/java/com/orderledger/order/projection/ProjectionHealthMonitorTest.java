package com.orderledger.order.projection;

import com.orderledger.order.domain.events.OrderEvents.OrderCreatedEvent;
import com.orderledger.order.domain.events.OrderEvents.OrderItemAddedEvent;
import com.orderledger.order.projection.model.ProjectionProgress;
import com.orderledger.order.service.OrderEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: ProjectionHealthMonitor
 *
 * Product sales runs ASYNC, the other projections INLINE, so the only checkpoint row is
 * {@code product_sales:all}. Background rebuilds are captured by the fixture and run on demand.
 */
class ProjectionHealthMonitorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final long LAG_THRESHOLD = 1_000;

    ProjectionFixture fixture;
    ThreadPoolTaskScheduler taskScheduler;
    ProjectionHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        fixture = new ProjectionFixture();
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setThreadNamePrefix("monitor-test-");
        taskScheduler.initialize();
        monitor = monitor(fixture.eventStore, 30_000, true);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        taskScheduler.shutdown();
    }

    private ProjectionHealthMonitor monitor(OrderEventStore eventStore, long intervalMs, boolean enabled) {
        return monitor(eventStore, taskScheduler, intervalMs, enabled);
    }

    private ProjectionHealthMonitor monitor(OrderEventStore eventStore, TaskScheduler scheduler,
                                            long intervalMs, boolean enabled) {
        return new ProjectionHealthMonitor(eventStore, fixture.engine, fixture.rebuildService,
                fixture.statusRegistry, fixture.meterRegistry, scheduler, intervalMs, LAG_THRESHOLD, enabled);
    }

    /** 1000 orders, each created with four single-unit items: 5000 events. */
    private void commitFiveThousandEvents() {
        for (int order = 0; order < 1_000; order++) {
            String orderId = "ord-" + order;
            fixture.commit(new OrderCreatedEvent(orderId, "C" + (order % 7), "order " + order, T0));
            for (int item = 0; item < 4; item++) {
                fixture.commit(new OrderItemAddedEvent(orderId, "I" + item, "Item " + item, 1, T0.plusSeconds(order)));
            }
        }
    }

    private double lagGauge(ProjectionKind kind) {
        return fixture.meterRegistry.get("projection.lag").tag("shard", kind.getShardName()).gauge().value();
    }

    // ─── checkOnce Tests ──────────────────────────────────────────────────────

    @Test
    @DisplayName("checkOnce: shard 1500 behind is rebuilt until it reaches the end of the log")
    void checkOnce_shouldRebuildLaggingShard() {
        commitFiveThousandEvents();
        fixture.setCheckpoint(ProjectionKind.PRODUCT_SALES, 3_500);

        monitor.checkOnce();

        assertThat(lagGauge(ProjectionKind.PRODUCT_SALES)).isEqualTo(1_500.0);
        assertThat(fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES).getState()).isEqualTo(ShardState.REBUILDING);
        assertThat(fixture.submitted).hasSize(1);

        fixture.runSubmitted();

        assertThat(fixture.engine.checkpoint(ProjectionKind.PRODUCT_SALES)).isGreaterThanOrEqualTo(5_000L);
        assertThat(fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES).getState()).isEqualTo(ShardState.HEALTHY);
        assertThat(fixture.sales.load("I0").orElseThrow().getTotalQuantitySold()).isEqualTo(1_000);

        monitor.checkOnce();

        assertThat(lagGauge(ProjectionKind.PRODUCT_SALES)).isZero();
        assertThat(fixture.submitted).isEmpty();
    }

    @Test
    @DisplayName("checkOnce: a second pass during the rebuild does not start another")
    void checkOnce_shouldNotStackRebuilds() {
        commitFiveThousandEvents();
        fixture.setCheckpoint(ProjectionKind.PRODUCT_SALES, 3_500);

        monitor.checkOnce();
        monitor.checkOnce();

        assertThat(fixture.submitted).hasSize(1);
        assertThat(fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES).getState()).isEqualTo(ShardState.REBUILDING);
        verify(fixture.lease, times(1)).acquire(ProjectionKind.PRODUCT_SALES);
    }

    @Test
    @DisplayName("checkOnce: lag at or below the threshold is HEALTHY")
    void checkOnce_shouldReportHealthyShard() {
        commitFiveThousandEvents();
        fixture.setCheckpoint(ProjectionKind.PRODUCT_SALES, 4_000);

        monitor.checkOnce();

        ProjectionStatus status = fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES);
        assertThat(status.getState()).isEqualTo(ShardState.HEALTHY);
        assertThat(status.getLag()).isEqualTo(1_000L);
        assertThat(status.getLastCheckedAt()).isEqualTo(ProjectionFixture.NOW);
        assertThat(fixture.submitted).isEmpty();
    }

    @Test
    @DisplayName("checkOnce: empty log skips the pass")
    void checkOnce_shouldSkipEmptyLog() {
        fixture.setCheckpoint(ProjectionKind.PRODUCT_SALES, 0);

        monitor.checkOnce();

        assertThat(fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES).getLastCheckedAt()).isNull();
        assertThat(fixture.meterRegistry.find("projection.lag").gauge()).isNull();
        verify(fixture.progressRepository, never()).findAll();
    }

    @Test
    @DisplayName("checkOnce: failing high-water query is contained")
    void checkOnce_shouldContainQueryFailure() {
        OrderEventStore failing = mock(OrderEventStore.class);
        when(failing.maxGlobalSequence()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> monitor(failing, 30_000, true).checkOnce()).doesNotThrowAnyException();
        assertThat(fixture.submitted).isEmpty();
    }

    @Test
    @DisplayName("checkOnce: unknown shard gets a gauge but no rebuild")
    void checkOnce_shouldNotRebuildUnknownShard() {
        commitFiveThousandEvents();
        fixture.progressRows.put("inventory:all", ProjectionProgress.builder()
                .shardName("inventory:all").lastSequence(0).updatedAt(ProjectionFixture.NOW).build());

        monitor.checkOnce();

        assertThat(fixture.meterRegistry.get("projection.lag").tag("shard", "inventory:all").gauge().value())
                .isEqualTo(5_000.0);
        assertThat(fixture.submitted).isEmpty();
    }

    // ─── Lifecycle Tests ──────────────────────────────────────────────────────

    @Test
    @DisplayName("start/stop: scheduled passes run until stopped")
    void startStop_shouldRunAndHalt() {
        monitor = monitor(fixture.eventStore, 20, true);
        fixture.commit(new OrderCreatedEvent("ord-1", "C1", "test", T0));
        fixture.setCheckpoint(ProjectionKind.PRODUCT_SALES, 1);

        monitor.start();
        assertThat(monitor.isRunning()).isTrue();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> fixture.statusRegistry.get(ProjectionKind.PRODUCT_SALES).getLastCheckedAt() != null);

        monitor.stop();
        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("start/stop: pass is scheduled with a fixed delay and cancelled on stop")
    void startStop_shouldScheduleAndCancel() {
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> scheduled = mock(ScheduledFuture.class);
        doReturn(scheduled).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        monitor = monitor(fixture.eventStore, scheduler, 250, true);

        monitor.start();
        monitor.start();

        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(250)));

        monitor.stop();

        verify(scheduled).cancel(true);
        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("start: disabled monitor does not start")
    void start_shouldRespectEnabledFlag() {
        monitor = monitor(fixture.eventStore, 20, false);

        monitor.start();

        assertThat(monitor.isRunning()).isFalse();
        assertThat(taskScheduler.getScheduledThreadPoolExecutor().getQueue()).isEmpty();
    }
}
