package com.paycollect.api;

import com.paycollect.domain.exception.NotFoundException;
import com.paycollect.domain.exception.StoreException;
import com.paycollect.domain.model.CustomerDetails;
import com.paycollect.domain.model.CustomerSummary;
import com.paycollect.domain.model.PageParams;
import com.paycollect.domain.model.PagedResult;
import com.paycollect.domain.model.Pagination;
import com.paycollect.domain.service.CustomerQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = CustomerController.class)
class CustomerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CustomerQueryService customerQueryService;

    @Test
    void listUsesDefaultsForMissingOrNonNumericParams() throws Exception {
        PageParams defaults = new PageParams(1, 10);
        when(customerQueryService.listCustomers(defaults))
                .thenReturn(new PagedResult<>(List.of(summary("ACC001")), Pagination.byPageCount(defaults, 1)));

        mockMvc.perform(get("/customers").param("page", "first").param("limit", "many"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].account_number").value("ACC001"))
                .andExpect(jsonPath("$.data[0].issue_date").value("2023-01-15"))
                .andExpect(jsonPath("$.data[0].emi_due").value(5000.0))
                .andExpect(jsonPath("$.data[0].id").doesNotExist())
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.limit").value(10))
                .andExpect(jsonPath("$.pagination.hasMore").value(false));
    }

    @Test
    void listReturnsServerErrorOnStoreFailure() throws Exception {
        when(customerQueryService.listCustomers(new PageParams(1, 10)))
                .thenThrow(new StoreException("Failed to fetch customer data",
                        new DataAccessResourceFailureException("down")));

        mockMvc.perform(get("/customers"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Failed to fetch customer data"));
    }

    @Test
    void getReturnsFullRow() throws Exception {
        when(customerQueryService.getCustomer("ACC004")).thenReturn(CustomerDetails.builder()
                .id(4)
                .accountNumber("ACC004")
                .customerName("Aswin")
                .issueDate(LocalDate.of(2023, 8, 5))
                .interestRate(new BigDecimal("8.25"))
                .tenure(60)
                .emiDue(new BigDecimal("4200.00"))
                .totalLoanAmount(new BigDecimal("200000.00"))
                .build());

        mockMvc.perform(get("/customers/ACC004"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(4))
                .andExpect(jsonPath("$.data.customer_name").value("Aswin"))
                .andExpect(jsonPath("$.data.tenure").value(60))
                .andExpect(jsonPath("$.data.interest_rate").value(8.25));
    }

    @Test
    void getReturnsNotFound() throws Exception {
        when(customerQueryService.getCustomer("ACC999")).thenThrow(new NotFoundException("Customer not found"));

        mockMvc.perform(get("/customers/ACC999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Customer not found"));
    }

    private CustomerSummary summary(String accountNumber) {
        return CustomerSummary.builder()
                .accountNumber(accountNumber)
                .customerName("Alen")
                .issueDate(LocalDate.of(2023, 1, 15))
                .interestRate(new BigDecimal("8.50"))
                .tenure(24)
                .emiDue(new BigDecimal("5000.00"))
                .totalLoanAmount(new BigDecimal("100000.00"))
                .build();
    }
}
