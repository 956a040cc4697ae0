package com.orderledger.shared.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base envelope for every domain event written to an event stream.
 *
 * Every event carries:
 *  - id:         Globally unique event identifier (UUID v4), reused as the outbox id
 *  - type:       Dot-notation name, e.g. "orders.created" (see {@link EventTypes})
 *  - source:     Originating component, e.g. "/services/order-ledger"
 *  - occurredAt: When the fact happened, supplied by the caller and never by the store,
 *                so replaying a stream is deterministic
 *  - version:    Schema version for forward compatibility
 */
@Getter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;
    private final Instant occurredAt;
    private final int version;

    protected DomainEvent(String id, String type, String source, Instant occurredAt, int version) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.occurredAt = occurredAt;
        this.version = version;
    }

    protected DomainEvent(String id, String type, String source, Instant occurredAt) {
        this(id, type, source, occurredAt, 1);
    }
}
