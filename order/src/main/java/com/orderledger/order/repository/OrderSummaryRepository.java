package com.orderledger.order.repository;

import com.orderledger.order.projection.model.OrderSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderSummaryRepository extends JpaRepository<OrderSummary, String> {

    List<OrderSummary> findAllByOrderByUpdatedAtDesc();
}
