package com.paycollect.domain.service;

import com.paycollect.domain.exception.NotFoundException;
import com.paycollect.domain.exception.StoreException;
import com.paycollect.domain.exception.ValidationException;
import com.paycollect.domain.model.PaymentResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Entry point for payment submission.
 *
 * Input is validated here, outside any transaction, so a rejected request
 * never borrows a connection from the pool. Valid requests are handed to
 * {@link PaymentTransactionHandler}; store failures coming back are wrapped
 * in {@link StoreException} after the transaction has rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    public static final String REQUIRED_MESSAGE = "Account number and payment amount are required";
    public static final String NOT_POSITIVE_MESSAGE = "Payment amount must be greater than zero";
    public static final String TOO_LARGE_MESSAGE = "Payment amount exceeds the maximum allowed";
    public static final String FAILED_MESSAGE = "Failed to process payment";

    // DECIMAL(10,2)
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    private final PaymentTransactionHandler transactionHandler;
    private final MeterRegistry meterRegistry;

    public PaymentResult submitPayment(String accountNumber, BigDecimal paymentAmount) {
        BigDecimal amount;
        try {
            amount = validate(accountNumber, paymentAmount);
        } catch (ValidationException e) {
            log.warn("Payment rejected for account {}: {}", accountNumber, e.getMessage());
            count("validation_failed");
            throw e;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            PaymentResult result = transactionHandler.apply(accountNumber, amount);

            sample.stop(Timer.builder("payment.processing.latency").register(meterRegistry));
            count("success");

            log.info("Payment processed: id={}, account={}, amount={}, remainingDue={}",
                    result.getPaymentId(), accountNumber, amount, result.getRemainingDue());
            return result;

        } catch (NotFoundException e) {
            log.warn("Payment rejected, unknown account: {}", accountNumber);
            count("not_found");
            throw e;

        } catch (DataAccessException | TransactionException e) {
            log.error("Error processing payment for account {}: {}", accountNumber, e.getMessage(), e);
            count("error");
            throw new StoreException(FAILED_MESSAGE, e);
        }
    }

    /**
     * Domain-level guard for callers that bypass the HTTP constraints on
     * {@code PaymentRequestDto}. A zero amount counts as missing, and the amount
     * is rounded to cents before the range checks, as DECIMAL(10,2) stores it.
     */
    static BigDecimal validate(String accountNumber, BigDecimal paymentAmount) {
        if (!StringUtils.hasText(accountNumber) || paymentAmount == null || paymentAmount.signum() == 0) {
            throw new ValidationException(REQUIRED_MESSAGE);
        }
        BigDecimal amount = paymentAmount.setScale(2, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            throw new ValidationException(NOT_POSITIVE_MESSAGE);
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            throw new ValidationException(TOO_LARGE_MESSAGE);
        }
        return amount;
    }

    private void count(String result) {
        Counter.builder("payment.submitted")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
