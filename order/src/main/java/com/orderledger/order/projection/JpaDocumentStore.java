package com.orderledger.order.projection;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * {@link DocumentStore} over a Spring Data repository whose entity id is the document key.
 *
 * Loads take a row lock held until the caller's transaction ends, so two writers of the same
 * document (two commands adding the same item, a command and a rebuild batch) apply one after
 * the other.
 */
@RequiredArgsConstructor
public class JpaDocumentStore<D> implements DocumentStore<D> {

    private final JpaRepository<D, String> repository;
    private final EntityManager entityManager;
    private final Class<D> documentType;

    @Override
    public Optional<D> load(String key) {
        return Optional.ofNullable(entityManager.find(documentType, key, LockModeType.PESSIMISTIC_WRITE));
    }

    @Override
    public void upsert(String key, D document) {
        repository.save(document);
    }

    @Override
    public void deleteAll() {
        repository.deleteAllInBatch();
    }
}
