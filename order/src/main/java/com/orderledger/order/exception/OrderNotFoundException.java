package com.orderledger.order.exception;

import lombok.Getter;

@Getter
public class OrderNotFoundException extends OrderLedgerException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super(ErrorMessages.ORDER_NOT_FOUND + ": " + orderId);
        this.orderId = orderId;
    }
}
