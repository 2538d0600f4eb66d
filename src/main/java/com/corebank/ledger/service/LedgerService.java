package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionEntry.EntryType;
import com.corebank.ledger.domain.TransactionGroup;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.ImbalancedEntriesException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.AccountRepository;
import com.corebank.ledger.repository.TransactionEntryRepository;
import com.corebank.ledger.repository.TransactionGroupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Double-entry ledger engine.
 *
 * CRITICAL: every balance mutation in the system goes through
 * createBalancedTransaction, which in one unit of work:
 * 1. Validates the legs (at least two, every amount positive)
 * 2. Checks debits == credits within the configured tolerance
 * 3. Locks every real account row in LockOrdering order
 * 4. Writes the group header
 * 5. Applies each leg in request order and snapshots balance_after
 * 6. Writes the legs
 *
 * Any failure (unknown account, insufficient funds, store error) rolls the
 * whole unit back: no balance and no entry of the group is ever visible alone.
 *
 * Deposits and withdrawals are balanced against a virtual leg on the same
 * account. It records the cash side of the movement and never moves a balance.
 *
 * There is no idempotency key. Retrying a successful call creates a second
 * group.
 */
@Service
@Transactional
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final AccountRepository accountRepository;
    private final TransactionGroupRepository groupRepository;
    private final TransactionEntryRepository entryRepository;
    private final CoreBankProperties.Ledger limits;

    public LedgerService(
            AccountRepository accountRepository,
            TransactionGroupRepository groupRepository,
            TransactionEntryRepository entryRepository,
            CoreBankProperties properties) {
        this.accountRepository = accountRepository;
        this.groupRepository = groupRepository;
        this.entryRepository = entryRepository;
        this.limits = properties.getLedger();
    }

    /**
     * Deposit funds into an account.
     *
     * Legs: CREDIT account (real), DEBIT account (virtual cash leg).
     *
     * @return the real credit leg
     * @throws ValidationException if the amount is not positive or below the minimum
     * @throws NotFoundException if the account does not exist
     */
    public MovementRecord deposit(UUID accountId, BigDecimal amount, String description) {
        requireAccountId(accountId, "Account");
        BigDecimal value = validateMovementAmount(amount, null, "Deposit");
        String text = describe(description, "Deposit");

        BalancedTransaction tx = createBalancedTransaction(
                TransactionGroup.Kind.DEPOSIT,
                List.of(EntryRequest.credit(accountId, value, text),
                        EntryRequest.virtualDebit(accountId, value, text)),
                text);

        MovementRecord record = MovementRecord.of(tx.getGroup(), tx.realEntryFor(accountId));
        log.info("Deposit completed: account={}, amount={}, balanceAfter={}, group={}",
                accountId, value, record.getBalanceAfter(), record.getGroupId());
        return record;
    }

    /**
     * Withdraw funds from an account.
     *
     * Legs: DEBIT account (real), CREDIT account (virtual cash leg).
     *
     * @throws ValidationException if the amount is not positive or outside the limits
     * @throws com.corebank.ledger.exception.InsufficientFundsException if balance < amount
     * @throws NotFoundException if the account does not exist
     */
    public MovementRecord withdraw(UUID accountId, BigDecimal amount, String description) {
        requireAccountId(accountId, "Account");
        BigDecimal value = validateMovementAmount(amount, limits.getMaxWithdrawalAmount(), "Withdrawal");
        String text = describe(description, "Withdrawal");

        BalancedTransaction tx = createBalancedTransaction(
                TransactionGroup.Kind.WITHDRAWAL,
                List.of(EntryRequest.debit(accountId, value, text),
                        EntryRequest.virtualCredit(accountId, value, text)),
                text);

        MovementRecord record = MovementRecord.of(tx.getGroup(), tx.realEntryFor(accountId));
        log.info("Withdrawal completed: account={}, amount={}, balanceAfter={}, group={}",
                accountId, value, record.getBalanceAfter(), record.getGroupId());
        return record;
    }

    /**
     * Move funds between two accounts as one group of two real legs.
     *
     * Both rows are locked in LockOrdering order, not in from/to order.
     *
     * @throws BusinessRuleViolationException if from and to are the same account
     * @throws com.corebank.ledger.exception.InsufficientFundsException if the source balance < amount
     */
    public TransferResult transfer(UUID fromAccountId, UUID toAccountId, BigDecimal amount, String description) {
        requireAccountId(fromAccountId, "Source account");
        requireAccountId(toAccountId, "Destination account");
        if (fromAccountId.equals(toAccountId)) {
            throw new BusinessRuleViolationException("Cannot transfer to the same account");
        }
        BigDecimal value = validateMovementAmount(amount, limits.getMaxTransferAmount(), "Transfer");
        String text = describe(description, "Transfer");

        BalancedTransaction tx = createBalancedTransaction(
                TransactionGroup.Kind.TRANSFER,
                List.of(EntryRequest.debit(fromAccountId, value, text),
                        EntryRequest.credit(toAccountId, value, text)),
                text);

        TransferResult result = new TransferResult(
                MovementRecord.of(tx.getGroup(), tx.realEntryFor(fromAccountId)),
                MovementRecord.of(tx.getGroup(), tx.realEntryFor(toAccountId)));
        log.info("Transfer completed: from={}, to={}, amount={}, group={}",
                fromAccountId, toAccountId, value, tx.getGroup().getId());
        return result;
    }

    /**
     * General balanced-transaction primitive. Used by deposit, withdraw and
     * transfer above and by the investment engine.
     *
     * Calling it inside a unit of work that already holds some of the account
     * locks is fine: re-locking a row the transaction owns does not block.
     *
     * @throws ValidationException if fewer than two legs or a non-positive amount
     * @throws ImbalancedEntriesException if |debits - credits| exceeds the tolerance
     * @throws NotFoundException if a real leg names an unknown account
     */
    public BalancedTransaction createBalancedTransaction(TransactionGroup.Kind kind,
                                                         List<EntryRequest> entries,
                                                         String description) {
        if (kind == null) {
            throw new ValidationException("Transaction kind is required");
        }
        if (entries == null || entries.size() < 2) {
            throw new ValidationException("A balanced transaction needs at least two entries");
        }

        BigDecimal debitTotal = Amounts.ZERO_MONEY;
        BigDecimal creditTotal = Amounts.ZERO_MONEY;
        for (EntryRequest entry : entries) {
            if (entry == null || entry.getAccountId() == null || entry.getEntryType() == null) {
                throw new ValidationException("Every entry needs an account and an entry type");
            }
            if (entry.getAmount() == null || !Amounts.isPositive(Amounts.money(entry.getAmount()))) {
                throw new ValidationException("Entry amount must be positive at scale "
                        + Amounts.MONEY_SCALE + ", got " + entry.getAmount());
            }
            if (entry.getEntryType() == EntryType.DEBIT) {
                debitTotal = debitTotal.add(Amounts.money(entry.getAmount()));
            } else {
                creditTotal = creditTotal.add(Amounts.money(entry.getAmount()));
            }
        }
        if (debitTotal.subtract(creditTotal).abs().compareTo(limits.getBalanceTolerance()) > 0) {
            throw new ImbalancedEntriesException(debitTotal, creditTotal);
        }

        Map<UUID, Account> locked = lockAccounts(entries);

        TransactionGroup group = groupRepository.save(new TransactionGroup(kind, description, debitTotal));

        List<TransactionEntry> written = new ArrayList<>(entries.size());
        for (EntryRequest request : entries) {
            BigDecimal amount = Amounts.money(request.getAmount());
            BigDecimal balanceAfter = null;
            if (!request.isVirtual()) {
                Account account = locked.get(request.getAccountId());
                balanceAfter = request.getEntryType() == EntryType.DEBIT
                        ? account.debit(amount)
                        : account.credit(amount);
            }
            written.add(new TransactionEntry(group, request.getAccountId(), request.getEntryType(),
                    amount, balanceAfter, request.isVirtual(), request.getDescription()));
        }

        List<TransactionEntry> saved = entryRepository.saveAll(written);
        accountRepository.saveAll(locked.values());

        log.debug("Balanced transaction written: group={}, kind={}, legs={}, total={}",
                group.getId(), kind, saved.size(), debitTotal);
        return new BalancedTransaction(group, saved);
    }

    /**
     * Real ledger legs of an account, newest first. Virtual legs are excluded.
     */
    @Transactional(readOnly = true)
    public Page<TransactionEntry> getEntries(UUID accountId, Pageable pageable) {
        if (!accountRepository.existsById(accountId)) {
            throw new NotFoundException("Account not found: " + accountId);
        }
        return entryRepository.findByAccountIdAndVirtualLegFalseOrderByCreatedAtDesc(accountId, pageable);
    }

    @Transactional(readOnly = true)
    public BalancedTransaction getGroup(UUID groupId) {
        TransactionGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> new NotFoundException("Transaction group not found: " + groupId));
        return new BalancedTransaction(group, entryRepository.findByGroupIdOrderByCreatedAtAsc(groupId));
    }

    // ── helpers ──────────────────────────────────────────────────────────

    /**
     * Lock the real accounts of a request in global order. Virtual legs are
     * never locked.
     */
    private Map<UUID, Account> lockAccounts(List<EntryRequest> entries) {
        List<UUID> ids = entries.stream()
                .filter(e -> !e.isVirtual())
                .map(EntryRequest::getAccountId)
                .collect(Collectors.toList());

        Map<UUID, Account> locked = new LinkedHashMap<>();
        for (UUID id : LockOrdering.sorted(ids)) {
            Account account = accountRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new NotFoundException("Account not found: " + id));
            locked.put(id, account);
        }
        return locked;
    }

    private BigDecimal validateMovementAmount(BigDecimal amount, BigDecimal max, String what) {
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException(what + " amount must be positive");
        }
        BigDecimal value = Amounts.money(amount);
        BigDecimal min = limits.getMinTransactionAmount();
        if (min != null && value.compareTo(min) < 0) {
            throw new ValidationException(what + " amount must be at least " + min);
        }
        if (max != null && value.compareTo(max) > 0) {
            throw new ValidationException(what + " amount cannot exceed " + max);
        }
        return value;
    }

    private static void requireAccountId(UUID accountId, String what) {
        if (accountId == null) {
            throw new ValidationException(what + " id is required");
        }
    }

    private static String describe(String description, String fallback) {
        return (description == null || description.isBlank()) ? fallback : description.trim();
    }
}
