package com.orderledger.order.repository;

import com.orderledger.order.domain.OrderSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderSnapshotRepository extends JpaRepository<OrderSnapshot, String> {
}
