package com.orderledger.order.repository;

import com.orderledger.order.projection.model.ProductSales;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductSalesRepository extends JpaRepository<ProductSales, String> {

    List<ProductSales> findAllByOrderByTotalQuantitySoldDescIdAsc(Pageable page);
}
