package com.corebank.ledger.controller;

import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionEntry.EntryType;
import com.corebank.ledger.domain.TransactionGroup;
import com.corebank.ledger.dto.OpenAccountRequest;
import com.corebank.ledger.dto.TransactionRequest;
import com.corebank.ledger.dto.TransferRequest;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.InsufficientFundsException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.StoreFailureException;
import com.corebank.ledger.service.AccountService;
import com.corebank.ledger.service.LedgerService;
import com.corebank.ledger.service.MovementRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller slice tests: HTTP contract and error mapping.
 * No database. Services are mocked.
 */
@WebMvcTest(AccountController.class)
class AccountControllerTest {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean AccountService accountService;
    @MockBean LedgerService  ledgerService;

    private final UUID accountId = UUID.randomUUID();
    private final UUID ownerId   = UUID.randomUUID();

    private Account stubAccount;

    @BeforeEach
    void setUp() throws Exception {
        stubAccount = new Account(ownerId, "ACC000000000042", Account.AccountType.CHECKING);
        var idField = Account.class.getDeclaredField("id");
        idField.setAccessible(true);
        idField.set(stubAccount, accountId);
    }

    private MovementRecord creditRecord(String amount) {
        TransactionGroup group = new TransactionGroup(TransactionGroup.Kind.DEPOSIT, "Deposit", new BigDecimal(amount));
        TransactionEntry entry = new TransactionEntry(group, accountId, EntryType.CREDIT,
                new BigDecimal(amount), new BigDecimal(amount), false, "Deposit");
        return MovementRecord.of(group, entry);
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    // ── open account → 201 ───────────────────────────────────────────────────

    @Test @DisplayName("POST /accounts → 201 with account number")
    void openAccount() throws Exception {
        when(accountService.openAccount(ownerId, Account.AccountType.CHECKING, null)).thenReturn(stubAccount);

        mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new OpenAccountRequest(ownerId, Account.AccountType.CHECKING, null))))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.accountNumber").value("ACC000000000042"))
               .andExpect(jsonPath("$.accountType").value("CHECKING"));
    }

    @Test @DisplayName("POST /accounts without owner → 400 field map")
    void openAccountMissingOwner() throws Exception {
        mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new OpenAccountRequest(null, Account.AccountType.SAVINGS, null))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.ownerId").exists());
        verifyNoInteractions(accountService);
    }

    @Test @DisplayName("POST /accounts second savings → 422")
    void openAccountRuleViolation() throws Exception {
        when(accountService.openAccount(any(), any(), any()))
            .thenThrow(new BusinessRuleViolationException("already has a savings account"));

        mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new OpenAccountRequest(ownerId, Account.AccountType.SAVINGS, null))))
               .andExpect(status().isUnprocessableEntity())
               .andExpect(jsonPath("$.error").value("BUSINESS_RULE_VIOLATION"));
    }

    // ── reads ────────────────────────────────────────────────────────────────

    @Test @DisplayName("GET /accounts/{id} unknown → 404")
    void getAccountNotFound() throws Exception {
        when(accountService.getAccount(accountId)).thenThrow(new NotFoundException("Account not found"));

        mockMvc.perform(get("/accounts/" + accountId))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"))
               .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test @DisplayName("GET /accounts/{id} with a malformed id → 400")
    void getAccountMalformedId() throws Exception {
        mockMvc.perform(get("/accounts/not-a-uuid"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test @DisplayName("responses carry an X-Request-Id header")
    void requestIdHeader() throws Exception {
        when(accountService.getAccount(accountId)).thenReturn(stubAccount);

        mockMvc.perform(get("/accounts/" + accountId).header("X-Request-Id", "req-123"))
               .andExpect(status().isOk())
               .andExpect(header().string("X-Request-Id", "req-123"));
    }

    // ── movements ────────────────────────────────────────────────────────────

    @Test @DisplayName("POST deposit → 200 with the credit leg")
    void deposit() throws Exception {
        when(ledgerService.deposit(eq(accountId), any(), any())).thenReturn(creditRecord("25.50"));

        mockMvc.perform(post("/accounts/" + accountId + "/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new TransactionRequest(new BigDecimal("25.50"), null))))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.kind").value("DEPOSIT"))
               .andExpect(jsonPath("$.entryType").value("CREDIT"))
               .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test @DisplayName("POST deposit with missing amount → 400")
    void depositMissingAmount() throws Exception {
        mockMvc.perform(post("/accounts/" + accountId + "/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new TransactionRequest(null, "x"))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.amount").exists());
    }

    @Test @DisplayName("POST withdraw insufficient funds → 409")
    void withdrawInsufficient() throws Exception {
        when(ledgerService.withdraw(eq(accountId), any(), any()))
            .thenThrow(new InsufficientFundsException(accountId, new BigDecimal("100.00"), new BigDecimal("150.00")));

        mockMvc.perform(post("/accounts/" + accountId + "/withdraw")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new TransactionRequest(new BigDecimal("150.00"), null))))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));
    }

    @Test @DisplayName("POST transfer to the same account → 422")
    void transferSameAccount() throws Exception {
        when(ledgerService.transfer(eq(accountId), eq(accountId), any(), any()))
            .thenThrow(new BusinessRuleViolationException("Cannot transfer to the same account"));

        mockMvc.perform(post("/accounts/" + accountId + "/transfer")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new TransferRequest(accountId, BigDecimal.TEN, null))))
               .andExpect(status().isUnprocessableEntity());
    }

    @Test @DisplayName("store failure → 503, retryable, no driver detail")
    void storeFailure() throws Exception {
        when(ledgerService.deposit(eq(accountId), any(), any()))
            .thenThrow(new StoreFailureException("Persistence failure: lock timeout on ACCOUNTS",
                    new CannotAcquireLockException("lock timeout on ACCOUNTS")));

        mockMvc.perform(post("/accounts/" + accountId + "/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new TransactionRequest(BigDecimal.TEN, null))))
               .andExpect(status().isServiceUnavailable())
               .andExpect(jsonPath("$.error").value("STORE_FAILURE"))
               .andExpect(jsonPath("$.retryable").value(true))
               .andExpect(jsonPath("$.message").value(not(containsString("ACCOUNTS"))));
    }
}
