package com.orderledger.order.repository;

import com.orderledger.order.projection.model.ProjectionProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProjectionProgressRepository extends JpaRepository<ProjectionProgress, String> {

    /**
     * Row lock on the shard checkpoint. Whoever holds it owns the shard's read model
     * until commit, so a daemon batch and a rebuild step never interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ProjectionProgress p WHERE p.shardName = :shardName")
    Optional<ProjectionProgress> findForUpdate(@Param("shardName") String shardName);
}
