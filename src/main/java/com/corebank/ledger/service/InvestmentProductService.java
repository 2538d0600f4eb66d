package com.corebank.ledger.service;

import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.repository.InvestmentProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Investment product catalogue.
 */
@Service
@Transactional
public class InvestmentProductService {

    private static final Logger log = LoggerFactory.getLogger(InvestmentProductService.class);

    private final InvestmentProductRepository productRepository;

    public InvestmentProductService(InvestmentProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * @throws ValidationException if the product code is already taken
     */
    public InvestmentProduct createProduct(InvestmentProduct product) {
        if (productRepository.existsByProductCode(product.getProductCode())) {
            throw new ValidationException("Product code " + product.getProductCode() + " already exists");
        }
        InvestmentProduct saved = productRepository.save(product);
        log.info("Investment product created: id={}, code={}, type={}",
                saved.getId(), saved.getProductCode(), saved.getProductType());
        return saved;
    }

    /**
     * Active products ordered by code, optionally restricted to one type.
     */
    @Transactional(readOnly = true)
    public List<InvestmentProduct> listProducts(InvestmentProduct.ProductType productType) {
        if (productType == null) {
            return productRepository.findByActiveTrueOrderByProductCodeAsc();
        }
        return productRepository.findByActiveTrueAndProductTypeOrderByProductCodeAsc(productType);
    }

    /**
     * Withdraw a product from sale. Existing holdings stay redeemable.
     */
    public InvestmentProduct deactivateProduct(UUID productId) {
        InvestmentProduct product = productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException("Investment product " + productId + " not found"));
        product.deactivate();
        log.info("Investment product deactivated: id={}, code={}", productId, product.getProductCode());
        return product;
    }

    @Transactional(readOnly = true)
    public long countActiveProducts() {
        return productRepository.countByActiveTrue();
    }

    @Transactional(readOnly = true)
    public InvestmentProduct getProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException("Investment product " + productId + " not found"));
    }
}
