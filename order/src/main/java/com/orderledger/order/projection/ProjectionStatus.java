package com.orderledger.order.projection;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class ProjectionStatus {
    ProjectionKind kind;
    ProjectionLifecycle lifecycle;
    ShardState state;
    long lastSequence;
    long lag;
    Instant lastCheckedAt;
    Instant lastRebuildStartedAt;
    Instant lastRebuildCompletedAt;
    String lastError;
}
