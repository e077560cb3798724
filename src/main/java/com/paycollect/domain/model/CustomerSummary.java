package com.paycollect.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.paycollect.infrastructure.persistence.entity.CustomerEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Customer projection used by the paginated listing. Leaves out the surrogate id
 * and the audit timestamps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"accountNumber", "issueDate", "interestRate", "tenure", "emiDue", "customerName", "totalLoanAmount"})
public class CustomerSummary {

    private String accountNumber;
    private LocalDate issueDate;
    private BigDecimal interestRate;
    private Integer tenure;
    private BigDecimal emiDue;
    private String customerName;
    private BigDecimal totalLoanAmount;

    public static CustomerSummary from(CustomerEntity entity) {
        return CustomerSummary.builder()
                .accountNumber(entity.getAccountNumber())
                .issueDate(entity.getIssueDate())
                .interestRate(entity.getInterestRate())
                .tenure(entity.getTenure())
                .emiDue(entity.getEmiDue())
                .customerName(entity.getCustomerName())
                .totalLoanAmount(entity.getTotalLoanAmount())
                .build();
    }
}
