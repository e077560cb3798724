package com.paycollect.api;

import com.paycollect.config.PaginationProperties;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.model.PaymentHistoryItem;
import com.paycollect.domain.model.PaymentListItem;
import com.paycollect.domain.model.PaymentResult;
import com.paycollect.domain.service.PaymentQueryService;
import com.paycollect.domain.service.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for EMI payments.
 */
@Slf4j
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final PaymentQueryService paymentQueryService;
    private final PaginationProperties paginationProperties;

    /**
     * Submit a payment against an account.
     *
     * POST /payments
     *
     * Request body: {@code {account_number, payment_amount}}
     * Response: payment id, amount applied and remaining due
     */
    @PostMapping
    public ResponseEntity<ApiResponse<PaymentResult>> submitPayment(@Valid @RequestBody PaymentRequestDto request) {
        log.info("Received payment request for account {}", request.getAccountNumber());

        PaymentResult result = paymentService.submitPayment(request.getAccountNumber(), request.getPaymentAmount());

        return ResponseEntity.ok(ApiResponse.ok("Payment processed successfully", result));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PaymentListItem>>> listPayments(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        PagedResult<PaymentListItem> result = paymentQueryService.listPayments(paginationProperties.resolve(page, limit));
        return ResponseEntity.ok(ApiResponse.ok(result.getItems(), result.getPagination()));
    }

    /**
     * Payment history of one account; empty for accounts with no payments.
     */
    @GetMapping("/{accountNumber}")
    public ResponseEntity<ApiResponse<List<PaymentHistoryItem>>> getPaymentHistory(@PathVariable String accountNumber) {
        return ResponseEntity.ok(ApiResponse.ok(paymentQueryService.getPaymentHistory(accountNumber)));
    }
}
