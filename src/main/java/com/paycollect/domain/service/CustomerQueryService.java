package com.paycollect.domain.service;

import com.paycollect.domain.exception.NotFoundException;
import com.paycollect.domain.exception.StoreException;
import com.paycollect.domain.model.CustomerDetails;
import com.paycollect.domain.model.CustomerSummary;
import com.paycollect.domain.model.PageParams;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.model.Pagination;
import com.paycollect.infrastructure.persistence.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Read-only customer queries. Each call runs in its own read-only transaction,
 * opened inside the error translation so that failing to obtain a connection is
 * reported like any other store failure.
 */
@Slf4j
@Service
public class CustomerQueryService {

    static final String FAILED_MESSAGE = "Failed to fetch customer data";

    private static final Sort BY_ACCOUNT_NUMBER = Sort.by(Sort.Direction.ASC, "accountNumber");

    private final CustomerRepository customerRepository;
    private final TransactionTemplate readOnlyTransaction;

    public CustomerQueryService(CustomerRepository customerRepository, PlatformTransactionManager transactionManager) {
        this.customerRepository = customerRepository;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
    }

    /**
     * Customers ordered by account number. A page starting at or past the last
     * row is answered from the count alone.
     */
    public PagedResult<CustomerSummary> listCustomers(PageParams params) {
        try {
            return readOnlyTransaction.execute(status -> {
                long total = customerRepository.count();
                List<CustomerSummary> items = params.getOffset() >= total
                        ? List.of()
                        : customerRepository.findPage(params.toPageable(BY_ACCOUNT_NUMBER)).stream()
                                .map(CustomerSummary::from)
                                .toList();
                return new PagedResult<>(items, Pagination.byPageCount(params, total));
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Error fetching customers: {}", e.getMessage(), e);
            throw new StoreException(FAILED_MESSAGE, e);
        }
    }

    public CustomerDetails getCustomer(String accountNumber) {
        try {
            return readOnlyTransaction.execute(status -> customerRepository.findByAccountNumber(accountNumber)
                    .map(CustomerDetails::from)
                    .orElseThrow(() -> new NotFoundException("Customer not found")));
        } catch (DataAccessException | TransactionException e) {
            log.error("Error fetching customer {}: {}", accountNumber, e.getMessage(), e);
            throw new StoreException(FAILED_MESSAGE, e);
        }
    }
}
