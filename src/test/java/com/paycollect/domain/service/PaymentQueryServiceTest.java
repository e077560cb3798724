package com.paycollect.domain.service;

import com.paycollect.domain.exception.StoreException;
import com.paycollect.domain.model.PageParams;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.model.PaymentListItem;
import com.paycollect.infrastructure.persistence.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentQueryServiceTest {

    @Mock private PaymentRepository paymentRepository;
    @Mock private PlatformTransactionManager transactionManager;

    private PaymentQueryService paymentQueryService;

    @BeforeEach
    void setUp() {
        paymentQueryService = new PaymentQueryService(paymentRepository, transactionManager);
    }

    @Test
    void listPayments_pagePastLastRow_returnsEmptyWithoutPageQuery() {
        when(paymentRepository.count()).thenReturn(5L);

        PagedResult<PaymentListItem> result = paymentQueryService.listPayments(new PageParams(30000000, 100));

        assertTrue(result.getItems().isEmpty());
        assertEquals(30000000, result.getPagination().getPage());
        assertEquals(5, result.getPagination().getTotal());
        assertFalse(result.getPagination().isHasMore());
        verify(paymentRepository, never()).findPageWithCustomerName(any());
    }

    @Test
    void listPayments_cannotOpenTransaction_reportedAsFetchFailure() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));

        StoreException ex = assertThrows(StoreException.class,
                () -> paymentQueryService.listPayments(new PageParams(1, 10)));

        assertEquals("Failed to fetch payment history", ex.getMessage());
        verifyNoInteractions(paymentRepository);
    }

    @Test
    void getPaymentHistory_cannotOpenTransaction_reportedAsFetchFailure() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("database down"));

        StoreException ex = assertThrows(StoreException.class,
                () -> paymentQueryService.getPaymentHistory("ACC001"));

        assertEquals("Failed to fetch payment history", ex.getMessage());
    }
}
