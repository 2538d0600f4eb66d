package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.ProductNav;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.InvestmentProductRepository;
import com.corebank.ledger.repository.ProductNavRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * NAV history and the pricing oracle backed by it.
 *
 * The current price is the NAV with the latest date. A product that has never
 * been priced falls back to corebank.pricing.default-unit-price; with no
 * default configured the price is not available.
 */
@Service
@Transactional
public class NavService implements PricingService {

    private static final Logger log = LoggerFactory.getLogger(NavService.class);

    private final ProductNavRepository navRepository;
    private final InvestmentProductRepository productRepository;
    private final CoreBankProperties.Pricing pricing;

    public NavService(
            ProductNavRepository navRepository,
            InvestmentProductRepository productRepository,
            CoreBankProperties properties) {
        this.navRepository = navRepository;
        this.productRepository = productRepository;
        this.pricing = properties.getPricing();
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal getCurrentUnitPrice(UUID productId) {
        return navRepository.findFirstByProductIdOrderByNavDateDesc(productId)
                .map(ProductNav::getUnitPrice)
                .or(() -> Optional.ofNullable(pricing.getDefaultUnitPrice()).map(Amounts::price))
                .orElseThrow(() -> new NotFoundException("No unit price available for product " + productId));
    }

    /**
     * Record the NAV of a product for a date. A second call for the same date
     * replaces the price.
     *
     * @param navDate the valuation date; null means today (UTC)
     */
    public ProductNav recordNav(UUID productId, LocalDate navDate, BigDecimal unitPrice) {
        if (!productRepository.existsById(productId)) {
            throw new NotFoundException("Investment product not found: " + productId);
        }
        if (!Amounts.isPositive(unitPrice)) {
            throw new ValidationException("Unit price must be positive");
        }
        LocalDate date = navDate != null ? navDate : LocalDate.now(ZoneOffset.UTC);

        ProductNav nav = navRepository.findByProductIdAndNavDate(productId, date)
                .map(existing -> {
                    existing.reprice(unitPrice);
                    return existing;
                })
                .orElseGet(() -> navRepository.save(new ProductNav(productId, date, unitPrice)));

        log.info("NAV recorded: product={}, date={}, unitPrice={}", productId, date, nav.getUnitPrice());
        return nav;
    }

    @Transactional(readOnly = true)
    public List<ProductNav> getNavHistory(UUID productId) {
        if (!productRepository.existsById(productId)) {
            throw new NotFoundException("Investment product not found: " + productId);
        }
        return navRepository.findByProductIdOrderByNavDateDesc(productId);
    }
}
