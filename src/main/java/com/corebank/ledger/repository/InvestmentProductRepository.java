package com.corebank.ledger.repository;

import com.corebank.ledger.domain.InvestmentProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvestmentProductRepository extends JpaRepository<InvestmentProduct, UUID> {

    Optional<InvestmentProduct> findByProductCode(String productCode);

    boolean existsByProductCode(String productCode);

    long countByActiveTrue();

    List<InvestmentProduct> findByActiveTrueOrderByProductCodeAsc();

    List<InvestmentProduct> findByActiveTrueAndProductTypeOrderByProductCodeAsc(InvestmentProduct.ProductType productType);

    List<InvestmentProduct> findTop3ByActiveTrueAndRiskLevelOrderByProductCodeAsc(int riskLevel);
}
