package com.orderledger.order.service;

import com.orderledger.order.projection.model.OrderSummary;
import com.orderledger.order.projection.model.OrderTimelineEntry;
import com.orderledger.order.projection.model.ProductSales;
import com.orderledger.order.repository.OrderSummaryRepository;
import com.orderledger.order.repository.OrderTimelineRepository;
import com.orderledger.order.repository.ProductSalesRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Order Query Service: Read Side (CQRS)
 *
 * Reads only projected documents, never the event log. Inline read models reflect every
 * committed command; async ones trail the log by the daemon's lag.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderQueryService {

    static final int MAX_TOP_PRODUCTS = 100;

    private final OrderSummaryRepository summaryRepository;
    private final OrderTimelineRepository timelineRepository;
    private final ProductSalesRepository productSalesRepository;

    public Optional<OrderSummary> getOrderSummary(String orderId) {
        return summaryRepository.findById(orderId);
    }

    /** Oldest first; events with equal timestamps keep log order. */
    public List<OrderTimelineEntry> getTimeline(String orderId) {
        return timelineRepository.findByOrderIdOrderByOccurredAtAscGlobalSequenceAsc(orderId);
    }

    /** Most recently updated first. */
    public List<OrderSummary> listOrders() {
        return summaryRepository.findAllByOrderByUpdatedAtDesc();
    }

    public Optional<ProductSales> getProductSales(String itemId) {
        return productSalesRepository.findById(itemId);
    }

    /**
     * Best sellers by total quantity; {@code n} is clamped to 1..100.
     */
    public List<ProductSales> topProducts(int n) {
        int limit = Math.max(1, Math.min(n, MAX_TOP_PRODUCTS));
        return productSalesRepository.findAllByOrderByTotalQuantitySoldDescIdAsc(PageRequest.of(0, limit));
    }
}
