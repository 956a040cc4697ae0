package com.orderledger.order.domain;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ShipOrderCommand {
    @NotBlank String orderId;
    Instant occurredAt;
}
