package com.paycollect.domain.service;

import com.paycollect.domain.exception.StoreException;
import com.paycollect.domain.model.PageParams;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.model.Pagination;
import com.paycollect.domain.model.PaymentHistoryItem;
import com.paycollect.domain.model.PaymentListItem;
import com.paycollect.infrastructure.persistence.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Slf4j
@Service
public class PaymentQueryService {

    static final String FAILED_MESSAGE = "Failed to fetch payment history";

    private final PaymentRepository paymentRepository;
    private final TransactionTemplate readOnlyTransaction;

    public PaymentQueryService(PaymentRepository paymentRepository, PlatformTransactionManager transactionManager) {
        this.paymentRepository = paymentRepository;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
    }

    /**
     * All payments, newest first, with the owning customer's name.
     */
    public PagedResult<PaymentListItem> listPayments(PageParams params) {
        try {
            return readOnlyTransaction.execute(status -> {
                long total = paymentRepository.count();
                List<PaymentListItem> items = params.getOffset() >= total
                        ? List.of()
                        : paymentRepository.findPageWithCustomerName(params.toPageable());
                return new PagedResult<>(items, Pagination.byOffset(params, total, items.size()));
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Error fetching all payments: {}", e.getMessage(), e);
            throw new StoreException(FAILED_MESSAGE, e);
        }
    }

    /**
     * Payments of one account, newest first. The account's existence is not
     * checked: an unknown account yields an empty list.
     */
    public List<PaymentHistoryItem> getPaymentHistory(String accountNumber) {
        try {
            return readOnlyTransaction.execute(status -> paymentRepository.findHistoryByAccountNumber(accountNumber));
        } catch (DataAccessException | TransactionException e) {
            log.error("Error fetching payment history for {}: {}", accountNumber, e.getMessage(), e);
            throw new StoreException(FAILED_MESSAGE, e);
        }
    }
}
