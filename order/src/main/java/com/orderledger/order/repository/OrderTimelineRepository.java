package com.orderledger.order.repository;

import com.orderledger.order.projection.model.OrderTimelineEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderTimelineRepository extends JpaRepository<OrderTimelineEntry, String> {

    List<OrderTimelineEntry> findByOrderIdOrderByOccurredAtAscGlobalSequenceAsc(String orderId);
}
