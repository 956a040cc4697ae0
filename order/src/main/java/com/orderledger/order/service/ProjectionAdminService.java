package com.orderledger.order.service;

import com.orderledger.order.projection.ProjectionEngine;
import com.orderledger.order.projection.ProjectionKind;
import com.orderledger.order.projection.ProjectionRebuildService;
import com.orderledger.order.projection.ProjectionStatus;
import com.orderledger.order.projection.ProjectionStatusRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Operational entry points for projections.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionAdminService {

    private final ProjectionRebuildService rebuildService;
    private final ProjectionStatusRegistry statusRegistry;
    private final ProjectionEngine engine;

    /**
     * Starts a background rebuild.
     *
     * @return false if the projection is already being rebuilt
     */
    public boolean triggerRebuild(ProjectionKind kind) {
        boolean started = rebuildService.rebuildAsync(kind);
        log.info("Rebuild requested: projection={}, started={}", kind.getIdentifier(), started);
        return started;
    }

    public boolean triggerRebuild(String projection) {
        return triggerRebuild(ProjectionKind.parse(projection));
    }

    /**
     * Status of every projection, with the lifecycle it runs under.
     */
    public List<ProjectionStatus> getProjectionStatus() {
        return statusRegistry.all().stream()
                .map(status -> status.toBuilder().lifecycle(engine.lifecycle(status.getKind())).build())
                .toList();
    }
}
