package com.orderledger.order.repository;

import com.orderledger.order.projection.model.ProjectionGuard;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProjectionGuardRepository extends JpaRepository<ProjectionGuard, String> {

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT g FROM ProjectionGuard g WHERE g.projection = :projection")
    Optional<ProjectionGuard> lockShared(@Param("projection") String projection);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM ProjectionGuard g WHERE g.projection = :projection")
    Optional<ProjectionGuard> lockExclusive(@Param("projection") String projection);

    @Modifying
    @Query(value = "INSERT INTO projection_guards (projection) VALUES (:projection) ON CONFLICT (projection) DO NOTHING",
            nativeQuery = true)
    int createIfAbsent(@Param("projection") String projection);
}
