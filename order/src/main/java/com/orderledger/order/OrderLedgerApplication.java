package com.orderledger.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Order Ledger: Entry Point
 *
 * Event-sourced orders: command handlers, event store, transactional outbox,
 * inline and async projections, projection health monitor.
 */
@SpringBootApplication(scanBasePackages = {"com.orderledger.order", "com.orderledger.shared"})
@EntityScan(basePackages = {"com.orderledger.order", "com.orderledger.shared"})
@EnableJpaRepositories(basePackages = {"com.orderledger.order", "com.orderledger.shared"})
public class OrderLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderLedgerApplication.class, args);
    }
}
