package com.corebank.ledger.integration;

import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.InvestmentHolding;
import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.domain.RiskAssessment;
import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionEntry.EntryType;
import com.corebank.ledger.exception.InsufficientFundsException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.repository.AccountRepository;
import com.corebank.ledger.repository.InvestmentHoldingRepository;
import com.corebank.ledger.repository.InvestmentTransactionRepository;
import com.corebank.ledger.repository.TransactionEntryRepository;
import com.corebank.ledger.service.AccountService;
import com.corebank.ledger.service.HoldingValuation;
import com.corebank.ledger.service.InvestmentProductService;
import com.corebank.ledger.service.InvestmentService;
import com.corebank.ledger.service.LedgerService;
import com.corebank.ledger.service.NavService;
import com.corebank.ledger.service.PortfolioService;
import com.corebank.ledger.service.PortfolioSummary;
import com.corebank.ledger.service.ProductRecommendation;
import com.corebank.ledger.service.RiskAssessmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Investment engine end to end: cash through the ledger, shares in holdings,
 * one investment transaction per operation.
 */
@SpringBootTest
@ActiveProfiles("test")
class InvestmentIntegrationTest {

    @Autowired AccountService                  accountService;
    @Autowired LedgerService                   ledgerService;
    @Autowired InvestmentProductService        productService;
    @Autowired NavService                      navService;
    @Autowired InvestmentService               investmentService;
    @Autowired PortfolioService                portfolioService;
    @Autowired RiskAssessmentService           riskAssessmentService;
    @Autowired AccountRepository               accountRepository;
    @Autowired InvestmentHoldingRepository     holdingRepository;
    @Autowired InvestmentTransactionRepository transactionRepository;
    @Autowired TransactionEntryRepository      entryRepository;

    private UUID userId;
    private Account account;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        account = accountService.openAccount(userId, Account.AccountType.CHECKING, new BigDecimal("5000.00"));
    }

    private InvestmentProduct newProduct(ProductType type) {
        String code = type.name().substring(0, 3) + "-" + UUID.randomUUID().toString().substring(0, 8);
        return productService.createProduct(new InvestmentProduct(code, "Test " + type, type, 2,
                new BigDecimal("1.00"), null, type == ProductType.FIXED_TERM ? 90 : null));
    }

    private BigDecimal balance() {
        return accountRepository.findById(account.getId()).orElseThrow().getBalance();
    }

    @Test @DisplayName("purchase then full redemption returns the cash and closes the holding")
    void roundTrip() {
        InvestmentProduct fund = newProduct(ProductType.MONEY_FUND);

        InvestmentTransaction bought = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("1000.00"));

        assertThat(bought.getShares()).isEqualByComparingTo("1000");
        assertThat(balance()).isEqualByComparingTo("4000.00");

        List<TransactionEntry> legs = ledgerService.getGroup(bought.getLedgerGroupId()).getEntries();
        assertThat(legs).hasSize(2).allMatch(leg -> leg.getAccountId().equals(account.getId()));
        assertThat(legs).filteredOn(leg -> !leg.isVirtualLeg())
            .singleElement()
            .satisfies(leg -> assertThat(leg.getEntryType()).isEqualTo(EntryType.DEBIT));
        assertThat(entryRepository.sumByGroupAndType(bought.getLedgerGroupId(), EntryType.DEBIT))
            .isEqualByComparingTo(entryRepository.sumByGroupAndType(bought.getLedgerGroupId(), EntryType.CREDIT));

        InvestmentTransaction sold = investmentService.redeem(userId, bought.getHoldingId(), null);

        assertThat(sold.getNetAmount()).isEqualByComparingTo("1000.0000");
        assertThat(balance()).isEqualByComparingTo("5000.00");
        InvestmentHolding holding = holdingRepository.findById(bought.getHoldingId()).orElseThrow();
        assertThat(holding.getStatus()).isEqualTo(InvestmentHolding.HoldingStatus.REDEEMED);
        assertThat(transactionRepository.findByHoldingIdOrderByCreatedAtAsc(holding.getId()))
            .extracting(InvestmentTransaction::getKind)
            .containsExactly(InvestmentTransaction.TransactionKind.PURCHASE,
                             InvestmentTransaction.TransactionKind.REDEMPTION);
    }

    @Test @DisplayName("buying again after a full redemption opens a new holding, the redeemed one stays closed")
    void repurchaseAfterFullRedemption() {
        InvestmentProduct fund = newProduct(ProductType.MONEY_FUND);

        InvestmentTransaction first = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("300.00"));
        investmentService.redeem(userId, first.getHoldingId(), null);
        InvestmentTransaction again = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("200.00"));

        assertThat(again.getHoldingId()).isNotEqualTo(first.getHoldingId());

        InvestmentHolding redeemed = holdingRepository.findById(first.getHoldingId()).orElseThrow();
        assertThat(redeemed.getStatus()).isEqualTo(InvestmentHolding.HoldingStatus.REDEEMED);
        assertThat(redeemed.getActiveKey()).isNull();

        InvestmentHolding fresh = holdingRepository.findById(again.getHoldingId()).orElseThrow();
        assertThat(fresh.getStatus()).isEqualTo(InvestmentHolding.HoldingStatus.ACTIVE);
        assertThat(fresh.getActiveKey()).isEqualTo(InvestmentHolding.activeKeyOf(userId, fund.getId()));
        assertThat(fresh.getShares()).isEqualByComparingTo("200");
        assertThat(fresh.getTotalInvested()).isEqualByComparingTo("200.00");

        assertThat(holdingRepository.findByUserIdAndStatus(userId, InvestmentHolding.HoldingStatus.ACTIVE))
            .extracting(InvestmentHolding::getId)
            .containsExactly(again.getHoldingId());
        assertThat(balance()).isEqualByComparingTo("4800.00");
    }

    @Test @DisplayName("second purchase at a higher NAV merges at weighted average cost ≈ 1.0476")
    void mergeAtNewPrice() {
        InvestmentProduct fund = newProduct(ProductType.MONEY_FUND);
        navService.recordNav(fund.getId(), LocalDate.of(2024, 1, 1), new BigDecimal("1.0000"));

        InvestmentTransaction first = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("100.00"));
        navService.recordNav(fund.getId(), LocalDate.of(2024, 1, 2), new BigDecimal("1.1000"));
        InvestmentTransaction second = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("100.00"));

        assertThat(second.getHoldingId()).isEqualTo(first.getHoldingId());
        InvestmentHolding holding = holdingRepository.findById(first.getHoldingId()).orElseThrow();
        assertThat(holding.getShares()).isEqualByComparingTo("190.90909091");
        assertThat(holding.getAverageCost()).isCloseTo(new BigDecimal("1.0476"), within(new BigDecimal("0.0001")));
        assertThat(holding.getTotalInvested()).isEqualByComparingTo("200.00");
    }

    @Test @DisplayName("valuation is read-only and repeatable")
    void valuationIdempotent() {
        InvestmentProduct fund = newProduct(ProductType.MUTUAL_FUND);
        navService.recordNav(fund.getId(), LocalDate.of(2024, 1, 1), new BigDecimal("1.0000"));
        investmentService.purchase(userId, account.getId(), fund.getId(), new BigDecimal("1000.00"));
        navService.recordNav(fund.getId(), LocalDate.of(2024, 2, 1), new BigDecimal("1.2000"));

        PortfolioSummary first = portfolioService.getPortfolioSummary(userId);
        PortfolioSummary second = portfolioService.getPortfolioSummary(userId);

        // 985 shares (1.5% fee) at 1.2000
        assertThat(first.getTotalAssets()).isEqualByComparingTo("1182.00");
        assertThat(first.getTotalInvested()).isEqualByComparingTo("985.00");
        assertThat(first.getTotalGainLoss()).isEqualByComparingTo("197.00");
        assertThat(first.getAssetAllocation()).containsOnlyKeys(ProductType.MUTUAL_FUND);
        assertThat(second.getTotalAssets()).isEqualTo(first.getTotalAssets());
        assertThat(second.getTotalGainLoss()).isEqualTo(first.getTotalGainLoss());

        List<HoldingValuation> holdings = portfolioService.getHoldings(userId);
        assertThat(holdings).singleElement()
            .satisfies(v -> assertThat(v.getHolding().getShares()).isEqualByComparingTo("985"));
    }

    @Test @DisplayName("purchase larger than the balance → InsufficientFunds, no holding")
    void purchaseInsufficientFunds() {
        InvestmentProduct fund = newProduct(ProductType.MONEY_FUND);

        assertThatThrownBy(() -> investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("5000.01")))
            .isInstanceOf(InsufficientFundsException.class);

        assertThat(balance()).isEqualByComparingTo("5000.00");
        assertThat(holdingRepository.findByUserIdOrderByPurchaseDateDesc(userId)).isEmpty();
    }

    @Test @DisplayName("deactivated product refuses purchases but its holdings stay redeemable")
    void deactivatedProduct() {
        InvestmentProduct fund = newProduct(ProductType.FIXED_TERM);
        InvestmentTransaction bought = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("200.00"));
        productService.deactivateProduct(fund.getId());

        assertThatThrownBy(() -> investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("200.00")))
            .isInstanceOf(NotFoundException.class);

        InvestmentTransaction sold = investmentService.redeem(userId, bought.getHoldingId(), null);
        assertThat(sold.getKind()).isEqualTo(InvestmentTransaction.TransactionKind.REDEMPTION);
        assertThat(holdingRepository.findById(bought.getHoldingId()).orElseThrow().getMaturityDate()).isNotNull();
    }

    @Test @DisplayName("another user cannot redeem the holding")
    void foreignRedeem() {
        InvestmentProduct fund = newProduct(ProductType.MONEY_FUND);
        InvestmentTransaction bought = investmentService.purchase(
                userId, account.getId(), fund.getId(), new BigDecimal("100.00"));

        assertThatThrownBy(() -> investmentService.redeem(UUID.randomUUID(), bought.getHoldingId(), null))
            .isInstanceOf(NotFoundException.class);
        assertThat(holdingRepository.findById(bought.getHoldingId()).orElseThrow().isActive()).isTrue();
    }

    @Test @DisplayName("recorded assessment is current and ranks a matching high-risk product first")
    void assessmentDrivesRecommendations() {
        InvestmentProduct growth = productService.createProduct(new InvestmentProduct(
                "GRW-" + UUID.randomUUID().toString().substring(0, 8), "Growth Fund", ProductType.MUTUAL_FUND, 5,
                new BigDecimal("1.00"), null, null));

        RiskAssessment recorded = riskAssessmentService.createAssessment(userId, 5,
                RiskAssessment.Experience.ADVANCED, RiskAssessment.Goal.AGGRESSIVE_GROWTH,
                RiskAssessment.Horizon.LONG_TERM, null);

        RiskAssessment current = riskAssessmentService.getCurrentAssessment(userId);
        assertThat(current.getId()).isEqualTo(recorded.getId());
        assertThat(current.getScore()).isEqualTo(100);

        List<ProductRecommendation> recommendations = riskAssessmentService.getRecommendations(userId);
        assertThat(recommendations).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(recommendations.get(0).getScore()).isEqualByComparingTo("1.0");
        assertThat(recommendations).anySatisfy(r -> {
            assertThat(r.getProduct().getId()).isEqualTo(growth.getId());
            assertThat(r.isRiskMatch()).isTrue();
            assertThat(r.getSuggestedAllocation()).isEqualByComparingTo("30");
        });
    }
}
