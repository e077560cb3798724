package com.paycollect.domain.service;

import com.paycollect.domain.exception.NotFoundException;
import com.paycollect.domain.model.PaymentResult;
import com.paycollect.infrastructure.persistence.entity.CustomerEntity;
import com.paycollect.infrastructure.persistence.entity.PaymentEntity;
import com.paycollect.infrastructure.persistence.entity.PaymentStatus;
import com.paycollect.infrastructure.persistence.repository.CustomerRepository;
import com.paycollect.infrastructure.persistence.repository.PaymentRepository;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Applies a validated payment to a customer account in a single transaction.
 *
 * Processing Flow:
 * 1. Lock the customer row (pessimistic write lock)
 * 2. Insert a completed payment row
 * 3. Reduce emi_due, clamped at zero
 * 4. Commit (all or nothing)
 *
 * Any exception thrown from here rolls the whole unit back. Lock timeouts and
 * deadlocks are retried, each attempt in a fresh transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentTransactionHandler {

    private final CustomerRepository customerRepository;
    private final PaymentRepository paymentRepository;

    @Transactional
    @Retry(name = "paymentSubmission")
    public PaymentResult apply(String accountNumber, BigDecimal amount) {
        CustomerEntity customer = customerRepository.findByAccountNumberForUpdate(accountNumber)
                .orElseThrow(() -> new NotFoundException("Customer account not found"));

        PaymentEntity payment = paymentRepository.save(PaymentEntity.builder()
                .customer(customer)
                .accountNumber(accountNumber)
                .paymentDate(LocalDateTime.now())
                .paymentAmount(amount)
                .status(PaymentStatus.COMPLETED)
                .build());

        BigDecimal previousDue = customer.getEmiDue();
        BigDecimal remainingDue = customer.applyPayment(amount);
        customerRepository.save(customer);

        log.debug("Applied payment {} to {}: due {} -> {}",
                payment.getId(), accountNumber, previousDue, remainingDue);

        return PaymentResult.builder()
                .paymentId(payment.getId())
                .accountNumber(accountNumber)
                .paymentAmount(amount)
                .remainingDue(remainingDue)
                .build();
    }
}
