package com.corebank.ledger.controller;

import com.corebank.ledger.dto.ApiResponses;
import com.corebank.ledger.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read access to transaction groups, virtual legs included.
 *
 * GET /ledger/groups/{groupId} → 200 | 404
 */
@RestController
@RequestMapping("/ledger")
@Tag(name = "Ledger", description = "Transaction groups and their entries")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping("/groups/{groupId}")
    @Operation(summary = "Get transaction group", description = "Group header with all of its legs")
    public ResponseEntity<ApiResponses.GroupResponse> getGroup(
            @Parameter(description = "Transaction group ID") @PathVariable UUID groupId) {
        return ResponseEntity.ok(new ApiResponses.GroupResponse(ledgerService.getGroup(groupId)));
    }
}
