package com.orderledger.order.projection;

import java.util.Optional;

/**
 * Keyed document storage for one read-model collection.
 * Writes join the caller's transaction.
 */
public interface DocumentStore<D> {

    Optional<D> load(String key);

    void upsert(String key, D document);

    void deleteAll();
}
