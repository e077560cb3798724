package com.paycollect.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.paycollect.infrastructure.persistence.entity.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Row of the all-payments listing, joined with the owning customer's name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentListItem {

    private Integer id;
    private LocalDateTime paymentDate;
    private BigDecimal paymentAmount;
    private PaymentStatus status;
    private String accountNumber;
    private String customerName;
}
