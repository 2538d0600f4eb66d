package com.corebank.ledger.domain;

import com.corebank.ledger.exception.InsufficientFundsException;
import com.corebank.ledger.exception.ValidationException;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Customer cash account.
 *
 * Critical financial rules:
 * - Balance has NO public setter; it moves only through credit()/debit(),
 *   which the ledger engine calls while holding the row lock
 * - Balance is never negative once committed
 * - Accounts are never deleted
 * - BigDecimal at scale 4 for every monetary value
 *
 * @Version is kept alongside the pessimistic row lock so that any write path
 * that skipped the lock fails loudly instead of losing an update.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_number", columnList = "account_number", unique = true),
        @Index(name = "idx_accounts_owner_id", columnList = "owner_id")
    }
)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_number", nullable = false, unique = true, length = 20, updatable = false)
    private String accountNumber;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 20, updatable = false)
    private AccountType accountType;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum AccountType {
        CHECKING,
        SAVINGS
    }

    protected Account() {
    }

    /**
     * Open an account with a zero balance. Initial funds arrive through a
     * ledgered deposit, never through the constructor.
     */
    public Account(UUID ownerId, String accountNumber, AccountType accountType) {
        if (ownerId == null) {
            throw new ValidationException("Owner cannot be null");
        }
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new ValidationException("Account number is required");
        }
        if (accountType == null) {
            throw new ValidationException("Account type is required");
        }
        this.ownerId = ownerId;
        this.accountNumber = accountNumber;
        this.accountType = accountType;
        this.balance = Amounts.ZERO_MONEY;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public AccountType getAccountType() {
        return accountType;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public boolean isOwnedBy(UUID userId) {
        return ownerId.equals(userId);
    }

    /**
     * Add funds. Only the ledger engine calls this, inside the unit of work
     * that also writes the matching entry.
     *
     * @return the balance after the credit
     */
    public BigDecimal credit(BigDecimal amount) {
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Credit amount must be positive");
        }
        this.balance = Amounts.money(this.balance.add(amount));
        this.updatedAt = Instant.now();
        return this.balance;
    }

    /**
     * Remove funds.
     *
     * @return the balance after the debit
     * @throws InsufficientFundsException if the balance would go negative
     */
    public BigDecimal debit(BigDecimal amount) {
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Debit amount must be positive");
        }
        BigDecimal newBalance = Amounts.money(this.balance.subtract(amount));
        if (newBalance.signum() < 0) {
            throw new InsufficientFundsException(id, balance, amount);
        }
        this.balance = newBalance;
        this.updatedAt = Instant.now();
        return this.balance;
    }

    public boolean hasSufficientBalance(BigDecimal amount) {
        return this.balance.compareTo(amount) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return id != null && Objects.equals(id, account.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", accountNumber='" + accountNumber + '\'' +
                ", ownerId=" + ownerId +
                ", accountType=" + accountType +
                ", balance=" + balance +
                ", version=" + version +
                '}';
    }
}
