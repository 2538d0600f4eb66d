package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Account opening and account reads.
 *
 * RULES ENFORCED ON OPENING:
 * - At most corebank.accounts.max-accounts-per-owner accounts per owner
 * - At most one SAVINGS account per owner
 * - Balance starts at zero; an initial deposit is a normal ledgered deposit
 *   in the same unit of work, so a failed deposit also undoes the opening
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String ACCOUNT_NUMBER_PREFIX = "ACC";
    private static final int NUMBER_ATTEMPTS = 10;

    private final AccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final CoreBankProperties.Accounts limits;

    public AccountService(
            AccountRepository accountRepository,
            LedgerService ledgerService,
            CoreBankProperties properties) {
        this.accountRepository = accountRepository;
        this.ledgerService = ledgerService;
        this.limits = properties.getAccounts();
    }

    /**
     * Open an account for an owner.
     *
     * @param initialDeposit optional; zero or null opens an empty account
     * @throws ValidationException if the owner or type is missing or the deposit is negative
     * @throws BusinessRuleViolationException if an opening rule is broken
     */
    public Account openAccount(UUID ownerId, Account.AccountType accountType, BigDecimal initialDeposit) {
        if (ownerId == null) {
            throw new ValidationException("Owner id is required");
        }
        if (accountType == null) {
            throw new ValidationException("Account type is required");
        }
        if (initialDeposit != null && initialDeposit.signum() < 0) {
            throw new ValidationException("Initial deposit cannot be negative");
        }

        long existing = accountRepository.countByOwnerId(ownerId);
        if (existing >= limits.getMaxAccountsPerOwner()) {
            throw new BusinessRuleViolationException(
                    "Owner " + ownerId + " already has the maximum of " + limits.getMaxAccountsPerOwner() + " accounts");
        }
        if (accountType == Account.AccountType.SAVINGS
                && accountRepository.existsByOwnerIdAndAccountType(ownerId, Account.AccountType.SAVINGS)) {
            throw new BusinessRuleViolationException("Owner " + ownerId + " already has a savings account");
        }

        Account account = accountRepository.save(new Account(ownerId, nextAccountNumber(), accountType));
        log.info("Account opened: id={}, number={}, owner={}, type={}",
                account.getId(), account.getAccountNumber(), ownerId, accountType);

        if (Amounts.isPositive(initialDeposit)) {
            ledgerService.deposit(account.getId(), initialDeposit, "Initial deposit");
        }
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
    }

    @Transactional(readOnly = true)
    public Account getAccountByNumber(String accountNumber) {
        return accountRepository.findByAccountNumber(accountNumber)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountNumber));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID ownerId) {
        return accountRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    @Transactional(readOnly = true)
    public AccountSummary getSummary(UUID ownerId) {
        return new AccountSummary(
                ownerId,
                accountRepository.countByOwnerId(ownerId),
                Amounts.money(accountRepository.sumBalanceByOwnerId(ownerId)));
    }

    @Transactional(readOnly = true)
    public long countAccounts() {
        return accountRepository.count();
    }

    /**
     * "ACC" followed by 12 random digits, unique among existing accounts.
     */
    String nextAccountNumber() {
        for (int attempt = 0; attempt < NUMBER_ATTEMPTS; attempt++) {
            long digits = ThreadLocalRandom.current().nextLong(1_000_000_000_000L);
            String candidate = ACCOUNT_NUMBER_PREFIX + String.format("%012d", digits);
            if (!accountRepository.existsByAccountNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique account number");
    }
}
