package com.orderledger.order.repository;

import com.orderledger.order.projection.model.ProductSaleContribution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProductSaleContributionRepository extends JpaRepository<ProductSaleContribution, String> {
}
