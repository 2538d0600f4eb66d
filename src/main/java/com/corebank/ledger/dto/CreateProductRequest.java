package com.corebank.ledger.dto;

import com.corebank.ledger.domain.InvestmentProduct;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for adding a product to the catalogue.
 */
public class CreateProductRequest {

    @NotBlank(message = "Product code is required")
    @Size(max = 32, message = "Product code must be at most 32 characters")
    private String productCode;

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Product type is required")
    private InvestmentProduct.ProductType productType;

    @Min(value = 1, message = "Risk level must be between 1 and 5")
    @Max(value = 5, message = "Risk level must be between 1 and 5")
    private int riskLevel = 1;

    private BigDecimal expectedReturnRate;

    @DecimalMin(value = "0.01", message = "Minimum investment must be at least 0.01")
    private BigDecimal minInvestmentAmount;

    private BigDecimal maxInvestmentAmount;

    @Positive(message = "Investment period must be positive")
    private Integer investmentPeriodDays;

    private String description;

    public CreateProductRequest() {
    }

    public InvestmentProduct toProduct() {
        InvestmentProduct product = new InvestmentProduct(productCode, name, productType, riskLevel,
                minInvestmentAmount, maxInvestmentAmount, investmentPeriodDays);
        product.setExpectedReturnRate(expectedReturnRate);
        product.setDescription(description);
        return product;
    }

    public String getProductCode() { return productCode; }
    public void setProductCode(String productCode) { this.productCode = productCode; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public InvestmentProduct.ProductType getProductType() { return productType; }
    public void setProductType(InvestmentProduct.ProductType productType) { this.productType = productType; }
    public int getRiskLevel() { return riskLevel; }
    public void setRiskLevel(int riskLevel) { this.riskLevel = riskLevel; }
    public BigDecimal getExpectedReturnRate() { return expectedReturnRate; }
    public void setExpectedReturnRate(BigDecimal expectedReturnRate) { this.expectedReturnRate = expectedReturnRate; }
    public BigDecimal getMinInvestmentAmount() { return minInvestmentAmount; }
    public void setMinInvestmentAmount(BigDecimal minInvestmentAmount) { this.minInvestmentAmount = minInvestmentAmount; }
    public BigDecimal getMaxInvestmentAmount() { return maxInvestmentAmount; }
    public void setMaxInvestmentAmount(BigDecimal maxInvestmentAmount) { this.maxInvestmentAmount = maxInvestmentAmount; }
    public Integer getInvestmentPeriodDays() { return investmentPeriodDays; }
    public void setInvestmentPeriodDays(Integer investmentPeriodDays) { this.investmentPeriodDays = investmentPeriodDays; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
