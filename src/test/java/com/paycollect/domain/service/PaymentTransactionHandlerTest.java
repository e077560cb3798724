package com.paycollect.domain.service;

import com.paycollect.domain.exception.NotFoundException;
import com.paycollect.domain.model.PaymentResult;
import com.paycollect.infrastructure.persistence.entity.CustomerEntity;
import com.paycollect.infrastructure.persistence.entity.PaymentEntity;
import com.paycollect.infrastructure.persistence.entity.PaymentStatus;
import com.paycollect.infrastructure.persistence.repository.CustomerRepository;
import com.paycollect.infrastructure.persistence.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentTransactionHandlerTest {

    @Mock private CustomerRepository customerRepository;
    @Mock private PaymentRepository paymentRepository;

    private PaymentTransactionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new PaymentTransactionHandler(customerRepository, paymentRepository);
    }

    @Test
    void apply_partialPayment_reducesDue_andRecordsCompletedPayment() {
        CustomerEntity customer = customer("ACC002", "3500.00");

        when(customerRepository.findByAccountNumberForUpdate("ACC002")).thenReturn(Optional.of(customer));
        when(paymentRepository.save(any(PaymentEntity.class))).thenAnswer(i -> {
            PaymentEntity saved = i.getArgument(0);
            saved.setId(42);
            return saved;
        });

        PaymentResult result = handler.apply("ACC002", new BigDecimal("1000.00"));

        assertEquals(42, result.getPaymentId());
        assertEquals("ACC002", result.getAccountNumber());
        assertEquals(0, result.getPaymentAmount().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, result.getRemainingDue().compareTo(new BigDecimal("2500.00")));
        assertEquals(0, customer.getEmiDue().compareTo(new BigDecimal("2500.00")));

        ArgumentCaptor<PaymentEntity> captor = ArgumentCaptor.forClass(PaymentEntity.class);
        verify(paymentRepository).save(captor.capture());
        PaymentEntity payment = captor.getValue();
        assertEquals(PaymentStatus.COMPLETED, payment.getStatus());
        assertSame(customer, payment.getCustomer());
        assertEquals("ACC002", payment.getAccountNumber());
        assertNotNull(payment.getPaymentDate());

        verify(customerRepository).save(customer);
    }

    @Test
    void apply_overpayment_clampsDueAtZero() {
        CustomerEntity customer = customer("ACC001", "5000.00");

        when(customerRepository.findByAccountNumberForUpdate("ACC001")).thenReturn(Optional.of(customer));
        when(paymentRepository.save(any(PaymentEntity.class))).thenAnswer(i -> i.getArgument(0));

        PaymentResult result = handler.apply("ACC001", new BigDecimal("7500.00"));

        assertEquals(new BigDecimal("0.00"), result.getRemainingDue());
        assertEquals(new BigDecimal("0.00"), customer.getEmiDue());
    }

    @Test
    void apply_unknownAccount_throwsNotFound_andWritesNothing() {
        when(customerRepository.findByAccountNumberForUpdate("ACC999")).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> handler.apply("ACC999", new BigDecimal("100.00")));

        assertEquals("Customer account not found", ex.getMessage());
        verify(paymentRepository, never()).save(any());
        verify(customerRepository, never()).save(any());
    }

    private CustomerEntity customer(String accountNumber, String emiDue) {
        return CustomerEntity.builder()
                .id(1)
                .accountNumber(accountNumber)
                .customerName("Test Customer")
                .issueDate(LocalDate.of(2023, 1, 15))
                .interestRate(new BigDecimal("8.50"))
                .tenure(24)
                .emiDue(new BigDecimal(emiDue))
                .totalLoanAmount(new BigDecimal("100000.00"))
                .build();
    }
}
