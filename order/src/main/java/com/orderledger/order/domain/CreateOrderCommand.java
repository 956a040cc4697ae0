package com.orderledger.order.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Create Order Command: starts a new order stream.
 * {@code occurredAt} is optional; the handler stamps the current time when it is absent.
 */
@Value
@Builder
public class CreateOrderCommand {
    @NotBlank String orderId;
    @NotBlank String customerId;
    @NotBlank @Size(max = 500) String description;
    Instant occurredAt;
}
