package com.orderledger.order.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CancelOrderCommand {
    @NotBlank String orderId;
    @NotBlank @Size(max = 500) String reason;
    Instant occurredAt;
}
