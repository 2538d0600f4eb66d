package com.corebank.ledger.controller;

import com.corebank.ledger.exception.StoreFailureException;
import com.corebank.ledger.service.AccountService;
import com.corebank.ledger.service.InvestmentProductService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthCheckController.class)
class HealthCheckControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean AccountService           accountService;
    @MockBean InvestmentProductService productService;

    @Test @DisplayName("store reachable → 200 with account and active product counts")
    void up() throws Exception {
        when(accountService.countAccounts()).thenReturn(12L);
        when(productService.countActiveProducts()).thenReturn(3L);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.store.status").value("UP"))
            .andExpect(jsonPath("$.store.accounts").value(12))
            .andExpect(jsonPath("$.store.activeProducts").value(3));
    }

    @Test @DisplayName("store unavailable → 503 STORE_FAILURE, retryable")
    void storeDown() throws Exception {
        when(accountService.countAccounts())
            .thenThrow(new StoreFailureException("Persistence failure: query timeout",
                    new QueryTimeoutException("timeout")));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("STORE_FAILURE"))
            .andExpect(jsonPath("$.retryable").value(true));
        verifyNoInteractions(productService);
    }
}
