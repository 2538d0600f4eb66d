package com.corebank.ledger.controller;

import com.corebank.ledger.service.AccountService;
import com.corebank.ledger.service.InvestmentProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the engine and its store.
 *
 * Both counts are read through the services, so an unreachable or timed-out
 * store surfaces as STORE_FAILURE (503) from the exception handler.
 *
 * GET /health → 200 | 503
 */
@RestController
@RequestMapping("/health")
@Tag(name = "Health")
public class HealthCheckController {

    private final AccountService accountService;
    private final InvestmentProductService productService;

    public HealthCheckController(AccountService accountService, InvestmentProductService productService) {
        this.accountService = accountService;
        this.productService = productService;
    }

    @GetMapping
    @Operation(summary = "Health check", description = "Engine status with a round trip to the store")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Engine and store are up"),
        @ApiResponse(responseCode = "503", description = "Store unavailable")
    })
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> store = new LinkedHashMap<>();
        store.put("status", "UP");
        store.put("accounts", accountService.countAccounts());
        store.put("activeProducts", productService.countActiveProducts());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("application", "CoreBank Ledger");
        response.put("store", store);
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }
}
