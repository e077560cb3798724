package com.paycollect.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing a customer loan record.
 *
 * Rows are provisioned out of band. The only column this service ever writes
 * is {@code emi_due}, and only through {@link #applyPayment(BigDecimal)}.
 * Timestamps are maintained by the database.
 */
@Entity
@Table(name = "customers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "account_number", nullable = false, unique = true, updatable = false, length = 50)
    private String accountNumber;

    @Column(name = "customer_name", nullable = false, length = 100)
    private String customerName;

    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @Column(name = "interest_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal interestRate;

    @Column(nullable = false)
    private Integer tenure;

    @Column(name = "emi_due", nullable = false, precision = 10, scale = 2)
    private BigDecimal emiDue;

    @Column(name = "total_loan_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalLoanAmount;

    @Column(name = "created_at", insertable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private LocalDateTime updatedAt;

    /**
     * Reduce the due balance by a payment, clamping at zero.
     * Any amount beyond the current due is absorbed, not tracked as credit.
     *
     * @return the remaining due balance
     */
    public BigDecimal applyPayment(BigDecimal amount) {
        BigDecimal remaining = emiDue.subtract(amount);
        if (remaining.signum() < 0) {
            remaining = BigDecimal.ZERO;
        }
        this.emiDue = remaining.setScale(2, RoundingMode.HALF_UP);
        return this.emiDue;
    }
}
