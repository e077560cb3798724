package com.paycollect.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of a committed payment: the new payment row's id, the amount applied
 * and the customer's due balance after the payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentResult {

    private Integer paymentId;
    private String accountNumber;
    private BigDecimal paymentAmount;
    private BigDecimal remainingDue;
}
