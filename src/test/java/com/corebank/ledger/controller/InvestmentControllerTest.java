package com.corebank.ledger.controller;

import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.domain.InvestmentTransaction.TransactionKind;
import com.corebank.ledger.domain.RiskAssessment;
import com.corebank.ledger.domain.RiskAssessment.Experience;
import com.corebank.ledger.domain.RiskAssessment.Goal;
import com.corebank.ledger.domain.RiskAssessment.Horizon;
import com.corebank.ledger.dto.PurchaseRequest;
import com.corebank.ledger.dto.RedeemRequest;
import com.corebank.ledger.dto.RiskAssessmentRequest;
import com.corebank.ledger.exception.BusinessRuleViolationException;
import com.corebank.ledger.exception.NotFoundException;
import com.corebank.ledger.exception.ValidationException;
import com.corebank.ledger.service.InvestmentProductService;
import com.corebank.ledger.service.InvestmentService;
import com.corebank.ledger.service.NavService;
import com.corebank.ledger.service.PortfolioService;
import com.corebank.ledger.service.PortfolioSummary;
import com.corebank.ledger.service.ProductRecommendation;
import com.corebank.ledger.service.RiskAssessmentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InvestmentController.class)
class InvestmentControllerTest {

    private static final String USER = "X-User-Id";

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean InvestmentProductService productService;
    @MockBean NavService               navService;
    @MockBean InvestmentService        investmentService;
    @MockBean PortfolioService         portfolioService;
    @MockBean RiskAssessmentService    riskAssessmentService;

    private final UUID userId    = UUID.randomUUID();
    private final UUID accountId = UUID.randomUUID();
    private final UUID productId = UUID.randomUUID();
    private final UUID holdingId = UUID.randomUUID();

    private InvestmentTransaction transaction(TransactionKind kind, String shares, String gross, String fee, String net) {
        return InvestmentTransaction.builder()
                .userId(userId)
                .accountId(accountId)
                .productId(productId)
                .holdingId(holdingId)
                .ledgerGroupId(UUID.randomUUID())
                .kind(kind)
                .shares(new BigDecimal(shares))
                .unitPrice(BigDecimal.ONE)
                .grossAmount(new BigDecimal(gross))
                .fee(new BigDecimal(fee))
                .netAmount(new BigDecimal(net))
                .build();
    }

    // ── purchase ─────────────────────────────────────────────────────────────

    @Test @DisplayName("POST /investments/purchase → 201 with shares and fee")
    void purchase() throws Exception {
        when(investmentService.purchase(userId, accountId, productId, new BigDecimal("1000.00")))
            .thenReturn(transaction(TransactionKind.PURCHASE, "985", "1000.00", "15.00", "985.00"));

        mockMvc.perform(post("/investments/purchase")
                .header(USER, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new PurchaseRequest(accountId, productId, new BigDecimal("1000.00")))))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.kind").value("PURCHASE"))
               .andExpect(jsonPath("$.status").value("CONFIRMED"))
               .andExpect(jsonPath("$.fee").value(15.0))
               .andExpect(jsonPath("$.shares").value(985.0));
    }

    @Test @DisplayName("POST /investments/purchase without X-User-Id → 400")
    void purchaseWithoutUser() throws Exception {
        mockMvc.perform(post("/investments/purchase")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new PurchaseRequest(accountId, productId, BigDecimal.TEN))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        verifyNoInteractions(investmentService);
    }

    @Test @DisplayName("purchase of an inactive product → 404")
    void purchaseInactiveProduct() throws Exception {
        when(investmentService.purchase(any(), any(), any(), any()))
            .thenThrow(new NotFoundException("Investment product not found or inactive"));

        mockMvc.perform(post("/investments/purchase")
                .header(USER, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new PurchaseRequest(accountId, productId, BigDecimal.TEN))))
               .andExpect(status().isNotFound());
    }

    // ── redeem ───────────────────────────────────────────────────────────────

    @Test @DisplayName("POST redeem with no body redeems everything → 200")
    void redeemAll() throws Exception {
        when(investmentService.redeem(userId, holdingId, null))
            .thenReturn(transaction(TransactionKind.REDEMPTION, "1000", "1000.00", "0", "1000.00"));

        mockMvc.perform(post("/investments/holdings/" + holdingId + "/redeem")
                .header(USER, userId.toString()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.kind").value("REDEMPTION"))
               .andExpect(jsonPath("$.netAmount").value(1000.0));
    }

    @Test @DisplayName("redeem more shares than held → 400")
    void redeemTooMany() throws Exception {
        when(investmentService.redeem(eq(userId), eq(holdingId), any()))
            .thenThrow(new ValidationException("Cannot redeem 11 shares, holding has 10"));

        mockMvc.perform(post("/investments/holdings/" + holdingId + "/redeem")
                .header(USER, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RedeemRequest(new BigDecimal("11")))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test @DisplayName("redeem a closed holding → 422")
    void redeemClosed() throws Exception {
        when(investmentService.redeem(eq(userId), eq(holdingId), any()))
            .thenThrow(new BusinessRuleViolationException("Cannot redeem a holding that is REDEEMED"));

        mockMvc.perform(post("/investments/holdings/" + holdingId + "/redeem")
                .header(USER, userId.toString()))
               .andExpect(status().isUnprocessableEntity());
    }

    // ── catalogue and portfolio ──────────────────────────────────────────────

    @Test @DisplayName("GET /investments/products → 200 list")
    void listProducts() throws Exception {
        when(productService.listProducts(ProductType.MONEY_FUND)).thenReturn(List.of(
                new InvestmentProduct("MMF-01", "Cash Plus", ProductType.MONEY_FUND, 1, null, null, null)));

        mockMvc.perform(get("/investments/products").param("type", "MONEY_FUND"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[0].productCode").value("MMF-01"))
               .andExpect(jsonPath("$[0].active").value(true));
    }

    @Test @DisplayName("POST /investments/products with a risk level of 9 → 400")
    void createProductInvalid() throws Exception {
        String body = "{\"productCode\":\"X\",\"name\":\"X\",\"productType\":\"MUTUAL_FUND\",\"riskLevel\":9}";

        mockMvc.perform(post("/investments/products")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.riskLevel").exists());
        verifyNoInteractions(productService);
    }

    @Test @DisplayName("GET /investments/portfolio → 200 with allocation keyed by product type")
    void portfolio() throws Exception {
        Map<ProductType, BigDecimal> allocation = new EnumMap<>(ProductType.class);
        allocation.put(ProductType.MONEY_FUND, new BigDecimal("100.0000"));
        when(portfolioService.getPortfolioSummary(userId)).thenReturn(new PortfolioSummary(
                userId, new BigDecimal("1000.0000"), new BigDecimal("1000.0000"), new BigDecimal("0.0000"),
                new BigDecimal("0.0000"), allocation, 2, 1));

        mockMvc.perform(get("/investments/portfolio").header(USER, userId.toString()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.activeProductsCount").value(1))
               .andExpect(jsonPath("$.holdingsCount").value(2))
               .andExpect(jsonPath("$.assetAllocation.MONEY_FUND").value(100.0));
    }

    @Test @DisplayName("GET /investments/transactions passes filters and clamps page size")
    void transactions() throws Exception {
        when(portfolioService.getTransactions(eq(userId), eq(productId), eq(TransactionKind.PURCHASE), any()))
            .thenReturn(List.of());

        mockMvc.perform(get("/investments/transactions")
                .header(USER, userId.toString())
                .param("productId", productId.toString())
                .param("kind", "PURCHASE")
                .param("size", "5000"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$").isArray());

        verify(portfolioService).getTransactions(eq(userId), eq(productId), eq(TransactionKind.PURCHASE),
                argThat(p -> p.getPageSize() == 200 && p.getPageNumber() == 0));
    }

    // ── risk profile ─────────────────────────────────────────────────────────

    @Test @DisplayName("POST /investments/risk-assessment → 201 with the computed score")
    void createRiskAssessment() throws Exception {
        RiskAssessment assessment = new RiskAssessment(userId, 3, Experience.INTERMEDIATE, Goal.STEADY_GROWTH,
                Horizon.LONG_TERM, null, Instant.now().plus(365, ChronoUnit.DAYS));
        when(riskAssessmentService.createAssessment(userId, 3, Experience.INTERMEDIATE, Goal.STEADY_GROWTH,
                Horizon.LONG_TERM, null)).thenReturn(assessment);

        mockMvc.perform(post("/investments/risk-assessment")
                .header(USER, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RiskAssessmentRequest(
                        3, Experience.INTERMEDIATE, Goal.STEADY_GROWTH, Horizon.LONG_TERM))))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.assessmentScore").value(64))
               .andExpect(jsonPath("$.investmentGoal").value("STEADY_GROWTH"));
    }

    @Test @DisplayName("POST /investments/risk-assessment with tolerance 6 → 400 field error")
    void riskToleranceOutOfRange() throws Exception {
        mockMvc.perform(post("/investments/risk-assessment")
                .header(USER, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RiskAssessmentRequest(
                        6, Experience.BEGINNER, Goal.WEALTH_PRESERVATION, Horizon.SHORT_TERM))))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.riskTolerance").exists());
        verifyNoInteractions(riskAssessmentService);
    }

    @Test @DisplayName("GET /investments/risk-assessment with none current → 404")
    void noCurrentAssessment() throws Exception {
        when(riskAssessmentService.getCurrentAssessment(userId))
            .thenThrow(new NotFoundException("No current risk assessment for user " + userId));

        mockMvc.perform(get("/investments/risk-assessment").header(USER, userId.toString()))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test @DisplayName("GET /investments/recommendations → ranked products with allocation")
    void recommendations() throws Exception {
        InvestmentProduct product = new InvestmentProduct("MF-001", "Balanced Fund", ProductType.MUTUAL_FUND, 3,
                null, null, null);
        when(riskAssessmentService.getRecommendations(userId)).thenReturn(List.of(
                new ProductRecommendation(product, new BigDecimal("0.9700"), "Risk level matches your risk tolerance.",
                        true, new BigDecimal("30.0"))));

        mockMvc.perform(get("/investments/recommendations").header(USER, userId.toString()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[0].product.productCode").value("MF-001"))
               .andExpect(jsonPath("$[0].recommendationScore").value(0.97))
               .andExpect(jsonPath("$[0].riskMatch").value(true))
               .andExpect(jsonPath("$[0].suggestedAllocation").value(30.0));
    }
}
