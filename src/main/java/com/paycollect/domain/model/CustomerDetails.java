package com.paycollect.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.paycollect.infrastructure.persistence.entity.CustomerEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Full customer row as returned by the single-customer lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CustomerDetails {

    private Integer id;
    private String accountNumber;
    private String customerName;
    private LocalDate issueDate;
    private BigDecimal interestRate;
    private Integer tenure;
    private BigDecimal emiDue;
    private BigDecimal totalLoanAmount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CustomerDetails from(CustomerEntity entity) {
        return CustomerDetails.builder()
                .id(entity.getId())
                .accountNumber(entity.getAccountNumber())
                .customerName(entity.getCustomerName())
                .issueDate(entity.getIssueDate())
                .interestRate(entity.getInterestRate())
                .tenure(entity.getTenure())
                .emiDue(entity.getEmiDue())
                .totalLoanAmount(entity.getTotalLoanAmount())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
