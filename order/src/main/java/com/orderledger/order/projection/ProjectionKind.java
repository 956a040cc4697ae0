package com.orderledger.order.projection;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The read models maintained from the order event log.
 */
public enum ProjectionKind {

    ORDER_SUMMARY("order_summary"),
    PRODUCT_SALES("product_sales"),
    ORDER_TIMELINE("order_timeline");

    private final String identifier;

    ProjectionKind(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    /** Name of the progress row that tracks this projection when it runs asynchronously. */
    public String getShardName() {
        return identifier + ":all";
    }

    /**
     * Resolves a shard name to its projection by case-insensitive containment of the identifier.
     */
    public static Optional<ProjectionKind> fromShardName(String shardName) {
        if (shardName == null) return Optional.empty();
        String normalized = shardName.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> normalized.contains(kind.identifier))
                .findFirst();
    }

    /**
     * Accepts either the identifier ("product_sales") or the enum name ("PRODUCT_SALES").
     */
    public static ProjectionKind parse(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.identifier.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown projection: " + value));
    }
}
