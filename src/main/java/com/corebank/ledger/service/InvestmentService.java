package com.corebank.ledger.service;

import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.InvestmentHolding;
import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.domain.TransactionGroup;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.AccountRepository;
import com.corebank.ledger.repository.InvestmentHoldingRepository;
import com.corebank.ledger.repository.InvestmentHoldingRepository.HoldingRef;
import com.corebank.ledger.repository.InvestmentProductRepository;
import com.corebank.ledger.repository.InvestmentTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Investment accounting engine: converts cash to product shares and back.
 *
 * CRITICAL: purchase and redeem each run as one unit of work and:
 * 1. Resolve the unit price BEFORE taking any row lock
 * 2. Lock the account row before the holding row (never the reverse)
 * 3. Move cash only through LedgerService.createBalancedTransaction
 * 4. Write exactly one InvestmentTransaction per call
 *
 * Nothing here loads an account or holding entity unlocked before locking it
 * in the same unit of work. Pre-lock checks use existsByIdAndOwnerId and the
 * HoldingRef projection, so the locked read always sees committed state.
 *
 * Fees stay with the house: a purchase debits the full amount and only the
 * net amount becomes shares; a redemption credits gross minus fee.
 */
@Service
@Transactional
public class InvestmentService {

    private static final Logger log = LoggerFactory.getLogger(InvestmentService.class);

    private final LedgerService ledgerService;
    private final PricingService pricingService;
    private final FeeSchedule feeSchedule;
    private final AccountRepository accountRepository;
    private final InvestmentProductRepository productRepository;
    private final InvestmentHoldingRepository holdingRepository;
    private final InvestmentTransactionRepository transactionRepository;

    public InvestmentService(
            LedgerService ledgerService,
            PricingService pricingService,
            FeeSchedule feeSchedule,
            AccountRepository accountRepository,
            InvestmentProductRepository productRepository,
            InvestmentHoldingRepository holdingRepository,
            InvestmentTransactionRepository transactionRepository) {
        this.ledgerService = ledgerService;
        this.pricingService = pricingService;
        this.feeSchedule = feeSchedule;
        this.accountRepository = accountRepository;
        this.productRepository = productRepository;
        this.holdingRepository = holdingRepository;
        this.transactionRepository = transactionRepository;
    }

    /**
     * Buy shares of a product with cash from one of the user's accounts.
     *
     *   fee    = amount * purchase rate(product type)
     *   net    = amount - fee
     *   shares = net / unit price
     *
     * The first purchase opens an ACTIVE holding at average cost = unit price.
     * Later purchases merge into it at weighted-average cost. A fixed-term
     * maturity date is only set when the holding is opened.
     *
     * @throws NotFoundException if the product is unknown or inactive, or the account is not the user's
     * @throws ValidationException if the amount is outside the product's bounds
     * @throws com.corebank.ledger.exception.InsufficientFundsException if the account cannot cover the amount
     */
    public InvestmentTransaction purchase(UUID userId, UUID accountId, UUID productId, BigDecimal amount) {
        if (userId == null || accountId == null || productId == null) {
            throw new ValidationException("User, account and product are required");
        }
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Purchase amount must be positive");
        }
        BigDecimal value = Amounts.money(amount);

        InvestmentProduct product = productRepository.findById(productId)
                .filter(InvestmentProduct::isActive)
                .orElseThrow(() -> new NotFoundException("Investment product not found or inactive: " + productId));
        product.checkInvestmentAmount(value);

        if (!accountRepository.existsByIdAndOwnerId(accountId, userId)) {
            throw new NotFoundException("Account not found or not owned by user: " + accountId);
        }

        BigDecimal unitPrice = pricingService.getCurrentUnitPrice(productId);
        BigDecimal fee = feeSchedule.purchaseFee(product.getProductType(), value);
        BigDecimal netAmount = Amounts.money(value.subtract(fee));
        BigDecimal shares = netAmount.divide(unitPrice, Amounts.SHARE_SCALE, Amounts.ROUNDING);
        if (!Amounts.isPositive(shares)) {
            throw new ValidationException("Purchase amount buys no shares after fees");
        }

        String description = "Purchase " + product.getProductCode();
        BalancedTransaction cash = ledgerService.createBalancedTransaction(
                TransactionGroup.Kind.INVESTMENT_PURCHASE,
                List.of(EntryRequest.debit(accountId, value, description),
                        EntryRequest.virtualCredit(accountId, value, description)),
                description);

        InvestmentHolding holding = holdingRepository
                .findActiveByKeyForUpdate(InvestmentHolding.activeKeyOf(userId, productId))
                .map(existing -> {
                    existing.merge(shares, netAmount);
                    return existing;
                })
                .orElseGet(() -> holdingRepository.save(new InvestmentHolding(
                        userId, accountId, productId, shares, unitPrice, netAmount,
                        product.isFixedTerm() ? product.getInvestmentPeriodDays() : null)));

        InvestmentTransaction transaction = transactionRepository.save(InvestmentTransaction.builder()
                .userId(userId)
                .accountId(accountId)
                .productId(productId)
                .holdingId(holding.getId())
                .ledgerGroupId(cash.getGroup().getId())
                .kind(InvestmentTransaction.TransactionKind.PURCHASE)
                .shares(shares)
                .unitPrice(unitPrice)
                .grossAmount(value)
                .fee(fee)
                .netAmount(netAmount)
                .description(description)
                .build());

        log.info("Investment purchase: user={}, product={}, amount={}, fee={}, shares={}, holding={}",
                userId, product.getProductCode(), value, fee, shares, holding.getId());
        return transaction;
    }

    /**
     * Sell shares of a holding back to cash on the holding's account.
     *
     *   gross = shares * unit price
     *   fee   = gross * redemption rate(product type)
     *   net   = gross - fee, credited to the account
     *
     * Redeeming every share closes the holding as REDEEMED. A partial
     * redemption reduces shares and leaves average cost and total invested as
     * they were.
     *
     * @param shares shares to redeem; null redeems the whole holding
     * @throws NotFoundException if the holding does not exist or is not the user's
     * @throws BusinessRuleViolationException if the holding is not ACTIVE
     * @throws ValidationException if more shares are requested than held
     */
    public InvestmentTransaction redeem(UUID userId, UUID holdingId, BigDecimal shares) {
        if (userId == null || holdingId == null) {
            throw new ValidationException("User and holding are required");
        }
        if (shares != null && !Amounts.isPositive(shares)) {
            throw new ValidationException("Shares to redeem must be positive");
        }

        HoldingRef ref = holdingRepository.findRefById(holdingId)
                .filter(r -> r.getUserId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Investment holding not found or not owned by user: " + holdingId));
        InvestmentProduct product = productRepository.findById(ref.getProductId())
                .orElseThrow(() -> new NotFoundException("Investment product not found: " + ref.getProductId()));
        BigDecimal unitPrice = pricingService.getCurrentUnitPrice(ref.getProductId());

        // account row first, then the holding row
        Account account = accountRepository.findByIdForUpdate(ref.getAccountId())
                .orElseThrow(() -> new NotFoundException("Account not found: " + ref.getAccountId()));
        InvestmentHolding holding = holdingRepository.findByIdForUpdate(holdingId)
                .orElseThrow(() -> new NotFoundException("Investment holding not found: " + holdingId));

        if (!holding.isActive()) {
            throw new BusinessRuleViolationException("Cannot redeem a holding that is " + holding.getStatus());
        }
        BigDecimal redeemed = shares == null ? holding.getShares() : Amounts.shares(shares);
        if (redeemed.compareTo(holding.getShares()) > 0) {
            throw new ValidationException(String.format(
                    "Cannot redeem %s shares, holding has %s", redeemed, holding.getShares()));
        }

        BigDecimal grossAmount = Amounts.money(redeemed.multiply(unitPrice));
        BigDecimal fee = feeSchedule.redemptionFee(product.getProductType(), grossAmount);
        BigDecimal netAmount = Amounts.money(grossAmount.subtract(fee));
        if (!Amounts.isPositive(netAmount)) {
            throw new ValidationException("Redemption of " + redeemed + " shares is worth nothing after fees");
        }

        String description = "Redeem " + product.getProductCode();
        BalancedTransaction cash = ledgerService.createBalancedTransaction(
                TransactionGroup.Kind.INVESTMENT_REDEMPTION,
                List.of(EntryRequest.credit(account.getId(), netAmount, description),
                        EntryRequest.virtualDebit(account.getId(), netAmount, description)),
                description);

        boolean closed = holding.redeem(redeemed);

        InvestmentTransaction transaction = transactionRepository.save(InvestmentTransaction.builder()
                .userId(userId)
                .accountId(account.getId())
                .productId(product.getId())
                .holdingId(holding.getId())
                .ledgerGroupId(cash.getGroup().getId())
                .kind(InvestmentTransaction.TransactionKind.REDEMPTION)
                .shares(redeemed)
                .unitPrice(unitPrice)
                .grossAmount(grossAmount)
                .fee(fee)
                .netAmount(netAmount)
                .description(description)
                .build());

        log.info("Investment redemption: user={}, holding={}, shares={}, gross={}, fee={}, net={}, closed={}",
                userId, holdingId, redeemed, grossAmount, fee, netAmount, closed);
        return transaction;
    }
}
