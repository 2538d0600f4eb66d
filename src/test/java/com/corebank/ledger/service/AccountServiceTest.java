package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Account;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock AccountRepository accountRepository;
    @Mock LedgerService     ledgerService;

    AccountService service;

    private final UUID ownerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new AccountService(accountRepository, ledgerService, new CoreBankProperties());
    }

    private void stubSave() {
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> {
            Account account = inv.getArgument(0);
            var f = Account.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(account, UUID.randomUUID());
            return account;
        });
    }

    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("openAccount()")
    class OpenTests {

        @Test @DisplayName("opens with an ACC + 12 digit number and zero balance")
        void opens() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(0L);
            when(accountRepository.existsByAccountNumber(anyString())).thenReturn(false);
            stubSave();

            Account account = service.openAccount(ownerId, Account.AccountType.CHECKING, null);

            assertThat(account.getAccountNumber()).matches("ACC\\d{12}");
            assertThat(account.getBalance()).isEqualByComparingTo("0");
            verifyNoInteractions(ledgerService);
        }

        @Test @DisplayName("initial deposit goes through the ledger")
        void initialDeposit() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(1L);
            when(accountRepository.existsByAccountNumber(anyString())).thenReturn(false);
            stubSave();

            Account account = service.openAccount(ownerId, Account.AccountType.CHECKING, new BigDecimal("250.00"));

            verify(ledgerService).deposit(account.getId(), new BigDecimal("250.00"), "Initial deposit");
        }

        @Test @DisplayName("account number collision → retries with a new number")
        void numberCollision() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(0L);
            when(accountRepository.existsByAccountNumber(anyString())).thenReturn(true, false);
            stubSave();

            service.openAccount(ownerId, Account.AccountType.CHECKING, BigDecimal.ZERO);

            verify(accountRepository, times(2)).existsByAccountNumber(anyString());
        }

        @Test @DisplayName("sixth account → BusinessRuleViolation")
        void tooMany() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(5L);

            assertThatThrownBy(() -> service.openAccount(ownerId, Account.AccountType.CHECKING, null))
                .isInstanceOf(BusinessRuleViolationException.class)
                .hasMessageContaining("maximum");
            verify(accountRepository, never()).save(any());
        }

        @Test @DisplayName("second savings account → BusinessRuleViolation")
        void secondSavings() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(1L);
            when(accountRepository.existsByOwnerIdAndAccountType(ownerId, Account.AccountType.SAVINGS)).thenReturn(true);

            assertThatThrownBy(() -> service.openAccount(ownerId, Account.AccountType.SAVINGS, null))
                .isInstanceOf(BusinessRuleViolationException.class)
                .hasMessageContaining("savings");
        }

        @Test @DisplayName("negative initial deposit → ValidationException")
        void negativeDeposit() {
            assertThatThrownBy(() -> service.openAccount(ownerId, Account.AccountType.CHECKING, new BigDecimal("-1")))
                .isInstanceOf(ValidationException.class);
            verifyNoInteractions(accountRepository);
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("reads")
    class ReadTests {

        @Test @DisplayName("unknown id → NotFoundException")
        void unknownId() {
            UUID id = UUID.randomUUID();
            when(accountRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getAccount(id)).isInstanceOf(NotFoundException.class);
        }

        @Test @DisplayName("unknown number → NotFoundException")
        void unknownNumber() {
            when(accountRepository.findByAccountNumber("ACC999999999999")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getAccountByNumber("ACC999999999999"))
                .isInstanceOf(NotFoundException.class);
        }

        @Test @DisplayName("summary counts accounts and sums balances at money scale")
        void summary() {
            when(accountRepository.countByOwnerId(ownerId)).thenReturn(2L);
            when(accountRepository.sumBalanceByOwnerId(ownerId)).thenReturn(new BigDecimal("150.5"));

            AccountSummary summary = service.getSummary(ownerId);

            assertThat(summary.getAccountCount()).isEqualTo(2);
            assertThat(summary.getTotalBalance()).isEqualTo(new BigDecimal("150.5000"));
        }
    }
}
