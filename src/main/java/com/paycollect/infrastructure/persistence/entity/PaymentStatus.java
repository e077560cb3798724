package com.paycollect.infrastructure.persistence.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Values of the {@code payments.status} column. Stored and rendered in lower case.
 */
public enum PaymentStatus {
    COMPLETED("completed"),
    PENDING("pending"),
    FAILED("failed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PaymentStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }
}
