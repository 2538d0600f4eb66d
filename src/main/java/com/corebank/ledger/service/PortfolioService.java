package com.corebank.ledger.service;

import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.InvestmentHolding;
import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.repository.InvestmentHoldingRepository;
import com.corebank.ledger.repository.InvestmentProductRepository;
import com.corebank.ledger.repository.InvestmentTransactionRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the investment engine: valued holdings, the portfolio summary
 * and investment history. Takes no locks and writes nothing.
 *
 * Each unit price is looked up once per call, so two holdings of the same
 * product are valued consistently within one response.
 */
@Service
@Transactional(readOnly = true)
public class PortfolioService {

    private final InvestmentHoldingRepository holdingRepository;
    private final InvestmentProductRepository productRepository;
    private final InvestmentTransactionRepository transactionRepository;
    private final PricingService pricingService;

    public PortfolioService(
            InvestmentHoldingRepository holdingRepository,
            InvestmentProductRepository productRepository,
            InvestmentTransactionRepository transactionRepository,
            PricingService pricingService) {
        this.holdingRepository = holdingRepository;
        this.productRepository = productRepository;
        this.transactionRepository = transactionRepository;
        this.pricingService = pricingService;
    }

    /**
     * Every holding of the user, newest first, valued at current prices.
     */
    public List<HoldingValuation> getHoldings(UUID userId) {
        List<InvestmentHolding> holdings = holdingRepository.findByUserIdOrderByPurchaseDateDesc(userId);
        Map<UUID, BigDecimal> prices = new HashMap<>();
        return holdings.stream()
                .map(h -> HoldingValuation.of(h,
                        prices.computeIfAbsent(h.getProductId(), pricingService::getCurrentUnitPrice)))
                .collect(Collectors.toList());
    }

    /**
     * Totals and allocation over ACTIVE holdings only.
     */
    public PortfolioSummary getPortfolioSummary(UUID userId) {
        List<HoldingValuation> all = getHoldings(userId);
        List<HoldingValuation> active = all.stream()
                .filter(v -> v.getHolding().isActive())
                .collect(Collectors.toList());

        Map<UUID, ProductType> types = productRepository.findAllById(
                        active.stream().map(v -> v.getHolding().getProductId()).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(InvestmentProduct::getId, InvestmentProduct::getProductType));

        BigDecimal totalAssets = Amounts.ZERO_MONEY;
        BigDecimal totalInvested = Amounts.ZERO_MONEY;
        Map<ProductType, BigDecimal> valueByType = new EnumMap<>(ProductType.class);
        for (HoldingValuation valuation : active) {
            totalAssets = totalAssets.add(valuation.getCurrentValue());
            totalInvested = totalInvested.add(valuation.getHolding().getTotalInvested());
            ProductType type = types.get(valuation.getHolding().getProductId());
            if (type != null) {
                valueByType.merge(type, valuation.getCurrentValue(), BigDecimal::add);
            }
        }
        BigDecimal totalGainLoss = Amounts.money(totalAssets.subtract(totalInvested));
        BigDecimal finalTotalAssets = totalAssets;

        Map<ProductType, BigDecimal> allocation = valueByType.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> Amounts.percentage(e.getValue(), finalTotalAssets),
                        (a, b) -> a,
                        () -> new EnumMap<>(ProductType.class)));

        return new PortfolioSummary(
                userId,
                Amounts.money(totalAssets),
                Amounts.money(totalInvested),
                totalGainLoss,
                Amounts.percentage(totalGainLoss, totalInvested),
                allocation,
                all.size(),
                active.size());
    }

    /**
     * Investment history, newest first.
     *
     * @param productId null for every product
     * @param kind null for every kind
     */
    public List<InvestmentTransaction> getTransactions(UUID userId, UUID productId,
                                                       InvestmentTransaction.TransactionKind kind,
                                                       Pageable pageable) {
        if (productId != null && kind != null) {
            return transactionRepository.findByUserIdAndProductIdAndKindOrderByCreatedAtDesc(
                    userId, productId, kind, pageable);
        }
        if (productId != null) {
            return transactionRepository.findByUserIdAndProductIdOrderByCreatedAtDesc(userId, productId, pageable);
        }
        if (kind != null) {
            return transactionRepository.findByUserIdAndKindOrderByCreatedAtDesc(userId, kind, pageable);
        }
        return transactionRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }
}
