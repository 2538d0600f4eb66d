package com.corebank.ledger.controller;

import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.domain.RiskAssessment;
import com.corebank.ledger.dto.ApiResponses;
import com.corebank.ledger.dto.CreateProductRequest;
import com.corebank.ledger.dto.NavRequest;
import com.corebank.ledger.dto.PurchaseRequest;
import com.corebank.ledger.dto.RedeemRequest;
import com.corebank.ledger.dto.RiskAssessmentRequest;
import com.corebank.ledger.service.InvestmentProductService;
import com.corebank.ledger.service.InvestmentService;
import com.corebank.ledger.service.NavService;
import com.corebank.ledger.service.PortfolioService;
import com.corebank.ledger.service.RiskAssessmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for the investment engine.
 *
 * The caller is identified by the X-User-Id header. There is no
 * authentication; ownership is checked against that id inside the services.
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /investments/products                    → 200
 * POST   /investments/products                    → 201 | 400
 * GET    /investments/products/{productId}        → 200 | 404
 * POST   /investments/products/{productId}/nav    → 200 | 400 | 404
 * GET    /investments/products/{productId}/nav    → 200 | 404
 * POST   /investments/products/{productId}/deactivate → 200 | 404
 * POST   /investments/purchase                    → 201 | 400 | 404 | 409
 * POST   /investments/holdings/{holdingId}/redeem → 200 | 400 | 404 | 422
 * GET    /investments/holdings                    → 200
 * GET    /investments/portfolio                   → 200
 * GET    /investments/transactions                → 200
 * POST   /investments/risk-assessment             → 201 | 400
 * GET    /investments/risk-assessment             → 200 | 404
 * GET    /investments/recommendations             → 200
 */
@RestController
@RequestMapping("/investments")
@Tag(name = "Investments", description = "Products, purchases, redemptions and portfolio")
public class InvestmentController {

    static final String USER_HEADER = "X-User-Id";
    private static final int MAX_PAGE_SIZE = 200;

    private final InvestmentProductService productService;
    private final NavService navService;
    private final InvestmentService investmentService;
    private final PortfolioService portfolioService;
    private final RiskAssessmentService riskAssessmentService;

    public InvestmentController(
            InvestmentProductService productService,
            NavService navService,
            InvestmentService investmentService,
            PortfolioService portfolioService,
            RiskAssessmentService riskAssessmentService) {
        this.productService = productService;
        this.navService = navService;
        this.investmentService = investmentService;
        this.portfolioService = portfolioService;
        this.riskAssessmentService = riskAssessmentService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // PRODUCTS & PRICES
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/products")
    @Operation(summary = "List products", description = "Active products ordered by code, optionally of one type")
    public ResponseEntity<List<ApiResponses.ProductResponse>> listProducts(
            @RequestParam(required = false) InvestmentProduct.ProductType type) {
        return ResponseEntity.ok(productService.listProducts(type).stream()
                .map(ApiResponses.ProductResponse::new)
                .collect(Collectors.toList()));
    }

    @PostMapping("/products")
    @Operation(summary = "Create product")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Product created"),
        @ApiResponse(responseCode = "400", description = "Invalid input or duplicate product code")
    })
    public ResponseEntity<ApiResponses.ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        InvestmentProduct product = productService.createProduct(request.toProduct());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.ProductResponse(product));
    }

    @GetMapping("/products/{productId}")
    @Operation(summary = "Get product")
    public ResponseEntity<ApiResponses.ProductResponse> getProduct(
            @Parameter(description = "Product ID") @PathVariable UUID productId) {
        return ResponseEntity.ok(new ApiResponses.ProductResponse(productService.getProduct(productId)));
    }

    @PostMapping("/products/{productId}/deactivate")
    @Operation(summary = "Withdraw product from sale", description = "Existing holdings remain redeemable")
    public ResponseEntity<ApiResponses.ProductResponse> deactivateProduct(
            @Parameter(description = "Product ID") @PathVariable UUID productId) {
        return ResponseEntity.ok(new ApiResponses.ProductResponse(productService.deactivateProduct(productId)));
    }

    @PostMapping("/products/{productId}/nav")
    @Operation(summary = "Record NAV", description = "Set the unit price of a product for a date; replaces an existing price")
    public ResponseEntity<ApiResponses.NavResponse> recordNav(
            @Parameter(description = "Product ID") @PathVariable UUID productId,
            @Valid @RequestBody NavRequest request) {
        return ResponseEntity.ok(new ApiResponses.NavResponse(
                navService.recordNav(productId, request.getNavDate(), request.getUnitPrice())));
    }

    @GetMapping("/products/{productId}/nav")
    @Operation(summary = "NAV history", description = "Recorded prices, latest date first")
    public ResponseEntity<List<ApiResponses.NavResponse>> getNavHistory(
            @Parameter(description = "Product ID") @PathVariable UUID productId) {
        return ResponseEntity.ok(navService.getNavHistory(productId).stream()
                .map(ApiResponses.NavResponse::new)
                .collect(Collectors.toList()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // PURCHASE / REDEEM
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     * - 201 Created     → shares bought, returns the investment transaction
     * - 400 Bad Request → amount outside the product's bounds
     * - 404 Not Found   → product unknown or inactive, or account not the caller's
     * - 409 Conflict    → insufficient funds
     */
    @PostMapping("/purchase")
    @Operation(summary = "Purchase", description = "Buy shares of a product with cash from one of the caller's accounts")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Purchase confirmed"),
        @ApiResponse(responseCode = "400", description = "Invalid amount"),
        @ApiResponse(responseCode = "404", description = "Product or account not found"),
        @ApiResponse(responseCode = "409", description = "Insufficient funds")
    })
    public ResponseEntity<ApiResponses.InvestmentTransactionResponse> purchase(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody PurchaseRequest request) {

        InvestmentTransaction tx = investmentService.purchase(
                userId,
                request.getAccountId(),
                request.getProductId(),
                request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.InvestmentTransactionResponse(tx));
    }

    /**
     * HTTP Contract:
     * - 200 OK          → redemption confirmed, net amount credited
     * - 400 Bad Request → more shares than held
     * - 404 Not Found   → holding unknown or not the caller's
     * - 422             → holding is not ACTIVE
     */
    @PostMapping("/holdings/{holdingId}/redeem")
    @Operation(summary = "Redeem", description = "Sell shares of a holding; omit shares to redeem everything")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Redemption confirmed"),
        @ApiResponse(responseCode = "400", description = "Invalid share count"),
        @ApiResponse(responseCode = "404", description = "Holding not found"),
        @ApiResponse(responseCode = "422", description = "Holding is not active")
    })
    public ResponseEntity<ApiResponses.InvestmentTransactionResponse> redeem(
            @RequestHeader(USER_HEADER) UUID userId,
            @Parameter(description = "Holding ID") @PathVariable UUID holdingId,
            @Valid @RequestBody(required = false) RedeemRequest request) {

        InvestmentTransaction tx = investmentService.redeem(
                userId,
                holdingId,
                request != null ? request.getShares() : null);
        return ResponseEntity.ok(new ApiResponses.InvestmentTransactionResponse(tx));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // PORTFOLIO
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/holdings")
    @Operation(summary = "Holdings", description = "Every holding of the caller, valued at current prices")
    public ResponseEntity<List<ApiResponses.HoldingResponse>> getHoldings(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(portfolioService.getHoldings(userId).stream()
                .map(ApiResponses.HoldingResponse::new)
                .collect(Collectors.toList()));
    }

    @GetMapping("/portfolio")
    @Operation(summary = "Portfolio summary", description = "Totals and asset allocation over active holdings")
    public ResponseEntity<ApiResponses.PortfolioResponse> getPortfolio(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(new ApiResponses.PortfolioResponse(portfolioService.getPortfolioSummary(userId)));
    }

    @GetMapping("/transactions")
    @Operation(summary = "Investment history", description = "Newest first, optionally filtered by product and kind")
    public ResponseEntity<List<ApiResponses.InvestmentTransactionResponse>> getTransactions(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) InvestmentTransaction.TransactionKind kind,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {

        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        return ResponseEntity.ok(portfolioService.getTransactions(userId, productId, kind, pageRequest).stream()
                .map(ApiResponses.InvestmentTransactionResponse::new)
                .collect(Collectors.toList()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // RISK PROFILE
    // ─────────────────────────────────────────────────────────────────────────

    @PostMapping("/risk-assessment")
    @Operation(summary = "Submit risk assessment", description = "Record questionnaire answers; replaces the current assessment")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Assessment recorded"),
        @ApiResponse(responseCode = "400", description = "Invalid answers")
    })
    public ResponseEntity<ApiResponses.RiskAssessmentResponse> createRiskAssessment(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody RiskAssessmentRequest request) {

        RiskAssessment assessment = riskAssessmentService.createAssessment(
                userId,
                request.getRiskTolerance(),
                request.getInvestmentExperience(),
                request.getInvestmentGoal(),
                request.getInvestmentHorizon(),
                request.getMonthlyIncomeRange());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.RiskAssessmentResponse(assessment));
    }

    @GetMapping("/risk-assessment")
    @Operation(summary = "Current risk assessment", description = "404 when none was recorded or it has expired")
    public ResponseEntity<ApiResponses.RiskAssessmentResponse> getRiskAssessment(
            @RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(new ApiResponses.RiskAssessmentResponse(
                riskAssessmentService.getCurrentAssessment(userId)));
    }

    @GetMapping("/recommendations")
    @Operation(summary = "Product recommendations", description = "Active products ranked against the caller's risk profile")
    public ResponseEntity<List<ApiResponses.RecommendationResponse>> getRecommendations(
            @RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(riskAssessmentService.getRecommendations(userId).stream()
                .map(ApiResponses.RecommendationResponse::new)
                .collect(Collectors.toList()));
    }
}
