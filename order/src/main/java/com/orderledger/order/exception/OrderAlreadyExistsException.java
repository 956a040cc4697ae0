package com.orderledger.order.exception;

public class OrderAlreadyExistsException extends OrderConflictException {

    public OrderAlreadyExistsException(String orderId) {
        super(orderId, ErrorMessages.ORDER_ALREADY_EXISTS + ": " + orderId);
    }
}
