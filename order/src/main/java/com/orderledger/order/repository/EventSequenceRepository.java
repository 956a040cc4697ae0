package com.orderledger.order.repository;

import com.orderledger.order.domain.EventSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EventSequenceRepository extends JpaRepository<EventSequence, String> {

    /**
     * Held until commit; appends serialize on it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM EventSequence s WHERE s.name = :name")
    Optional<EventSequence> findForUpdate(@Param("name") String name);

    /**
     * Seeds the counter from the current log, so an existing log keeps its numbering.
     * A no-op when another transaction created the row first.
     */
    @Modifying
    @Query(value = """
            INSERT INTO event_sequences (name, last_value)
            SELECT :name, COALESCE(MAX(global_sequence), 0) FROM order_events
            ON CONFLICT (name) DO NOTHING
            """, nativeQuery = true)
    int createIfAbsent(@Param("name") String name);
}
