package com.orderledger.order.domain;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CommandValidationTest {

    static ValidatorFactory factory;
    static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static Set<String> invalidFields(Set<? extends ConstraintViolation<?>> violations) {
        return violations.stream().map(v -> v.getPropertyPath().toString()).collect(java.util.stream.Collectors.toSet());
    }

    @Test
    @DisplayName("CreateOrderCommand: blank description and over-long description are rejected")
    void createOrder_shouldValidateDescription() {
        CreateOrderCommand blank = CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description(" ").build();
        CreateOrderCommand tooLong = CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description("x".repeat(501)).build();
        CreateOrderCommand valid = CreateOrderCommand.builder()
                .orderId("ord-1").customerId("C1").description("x".repeat(500)).build();

        assertThat(invalidFields(validator.validate(blank))).containsExactly("description");
        assertThat(invalidFields(validator.validate(tooLong))).containsExactly("description");
        assertThat(validator.validate(valid)).isEmpty();
    }

    @Test
    @DisplayName("AddOrderItemCommand: item name limited to 200 chars, quantity to 10000")
    void addItem_shouldValidateNameAndUpperBound() {
        AddOrderItemCommand invalid = AddOrderItemCommand.builder()
                .orderId("ord-1").itemId("I1").itemName("n".repeat(201)).quantity(10_001).build();

        assertThat(invalidFields(validator.validate(invalid))).containsExactlyInAnyOrder("itemName", "quantity");
    }

    @Test
    @DisplayName("AddOrderItemCommand: non-positive quantity is left to the aggregate")
    void addItem_shouldNotRejectZeroQuantity() {
        AddOrderItemCommand zero = AddOrderItemCommand.builder()
                .orderId("ord-1").itemId("I1").itemName("Widget").quantity(0).build();

        assertThat(validator.validate(zero)).isEmpty();
    }

    @Test
    @DisplayName("CancelOrderCommand: reason is required")
    void cancel_shouldRequireReason() {
        CancelOrderCommand missing = CancelOrderCommand.builder().orderId("ord-1").build();

        assertThat(invalidFields(validator.validate(missing))).containsExactly("reason");
    }
}
