package com.paycollect.api;

import com.paycollect.config.PaginationProperties;
import com.paycollect.domain.model.CustomerDetails;
import com.paycollect.domain.model.CustomerSummary;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.service.CustomerQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to customer loan records.
 */
@Slf4j
@RestController
@RequestMapping("/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerQueryService customerQueryService;
    private final PaginationProperties paginationProperties;

    /**
     * GET /customers?page=&limit=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<CustomerSummary>>> listCustomers(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        PagedResult<CustomerSummary> result = customerQueryService.listCustomers(paginationProperties.resolve(page, limit));
        return ResponseEntity.ok(ApiResponse.ok(result.getItems(), result.getPagination()));
    }

    /**
     * GET /customers/{accountNumber}
     */
    @GetMapping("/{accountNumber}")
    public ResponseEntity<ApiResponse<CustomerDetails>> getCustomer(@PathVariable String accountNumber) {
        log.debug("Fetching customer {}", accountNumber);
        return ResponseEntity.ok(ApiResponse.ok(customerQueryService.getCustomer(accountNumber)));
    }
}
