package com.orderledger.order.domain;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Non-positive quantities are rejected by the aggregate, after its shipped and cancelled checks.
 */
@Value
@Builder
public class AddOrderItemCommand {
    @NotBlank String orderId;
    @NotBlank String itemId;
    @NotBlank @Size(max = 200) String itemName;
    @Max(10_000) int quantity;
    Instant occurredAt;
}
