package com.orderledger.order.repository;

import com.orderledger.order.domain.OrderEventRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderEventRecordRepository extends JpaRepository<OrderEventRecord, Long> {

    List<OrderEventRecord> findByOrderIdOrderBySequenceAsc(String orderId);

    List<OrderEventRecord> findByOrderIdAndSequenceGreaterThanOrderBySequenceAsc(String orderId, long sequence);

    List<OrderEventRecord> findByGlobalSequenceGreaterThanOrderByGlobalSequenceAsc(long globalSequence, Pageable page);

    boolean existsByOrderId(String orderId);

    @Query("SELECT COALESCE(MAX(e.sequence), 0) FROM OrderEventRecord e WHERE e.orderId = :orderId")
    long findMaxSequenceByOrderId(@Param("orderId") String orderId);

    @Query("SELECT COALESCE(MAX(e.globalSequence), 0) FROM OrderEventRecord e")
    long findMaxGlobalSequence();
}
