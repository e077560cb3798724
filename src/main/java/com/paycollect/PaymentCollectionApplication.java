package com.paycollect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Payment Collection Service
 *
 * REST API over customer loan records and their EMI payments.
 *
 * Architecture:
 * - MySQL store accessed through Spring Data JPA on a bounded Hikari pool
 * - Payment submission runs as one transaction with a row lock on the customer
 * - Read endpoints are read-only transactions (count and page see one snapshot)
 * - Lock contention retried through Resilience4j
 */
@SpringBootApplication
@EnableTransactionManagement
public class PaymentCollectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentCollectionApplication.class, args);
    }
}
