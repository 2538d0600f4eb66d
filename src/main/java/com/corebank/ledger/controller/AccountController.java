package com.corebank.ledger.controller;

import com.corebank.ledger.domain.Account;
import com.corebank.ledger.dto.ApiResponses;
import com.corebank.ledger.dto.OpenAccountRequest;
import com.corebank.ledger.dto.TransactionRequest;
import com.corebank.ledger.dto.TransferRequest;
import com.corebank.ledger.service.AccountService;
import com.corebank.ledger.service.LedgerService;
import com.corebank.ledger.service.MovementRecord;
import com.corebank.ledger.service.TransferResult;
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
 * REST controller for accounts and cash movements.
 *
 * RULES:
 * - No business logic: pure delegation to AccountService and LedgerService
 * - Every mutation is one unit of work inside the service
 * - DTOs are mapped at controller boundary; domain objects never leak
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /accounts                        → 201 | 400 | 422
 * GET    /accounts/{accountId}            → 200 | 404
 * GET    /accounts/by-number/{number}     → 200 | 404
 * GET    /accounts?ownerId=               → 200 (empty list if none)
 * GET    /accounts/{accountId}/entries    → 200 | 404
 * POST   /accounts/{accountId}/deposit    → 200 | 400 | 404
 * POST   /accounts/{accountId}/withdraw   → 200 | 400 | 404 | 409
 * POST   /accounts/{accountId}/transfer   → 200 | 400 | 404 | 409 | 422
 */
@RestController
@RequestMapping("/accounts")
@Tag(name = "Accounts & Movements", description = "Account opening, deposits, withdrawals and transfers")
public class AccountController {

    private static final int MAX_PAGE_SIZE = 200;

    private final AccountService accountService;
    private final LedgerService ledgerService;

    public AccountController(AccountService accountService, LedgerService ledgerService) {
        this.accountService = accountService;
        this.ledgerService = ledgerService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // ACCOUNTS
    // ─────────────────────────────────────────────────────────────────────────

    @PostMapping
    @Operation(summary = "Open account", description = "Open a checking or savings account, optionally with an initial deposit")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account opened"),
        @ApiResponse(responseCode = "400", description = "Invalid input"),
        @ApiResponse(responseCode = "422", description = "Account limit reached or second savings account")
    })
    public ResponseEntity<ApiResponses.AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        Account account = accountService.openAccount(
                request.getOwnerId(),
                request.getAccountType(),
                request.getInitialDeposit());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.AccountResponse(account));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account", description = "Account details and current balance")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Account found"),
        @ApiResponse(responseCode = "404", description = "Account not found")
    })
    public ResponseEntity<ApiResponses.AccountResponse> getAccount(
            @Parameter(description = "Account ID") @PathVariable UUID accountId) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(accountService.getAccount(accountId)));
    }

    @GetMapping("/by-number/{accountNumber}")
    @Operation(summary = "Get account by number")
    public ResponseEntity<ApiResponses.AccountResponse> getAccountByNumber(
            @Parameter(description = "Account number, e.g. ACC000000000001") @PathVariable String accountNumber) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(accountService.getAccountByNumber(accountNumber)));
    }

    @GetMapping
    @Operation(summary = "List accounts", description = "All accounts of an owner with count and total balance")
    public ResponseEntity<ApiResponses.AccountListResponse> listAccounts(@RequestParam UUID ownerId) {
        return ResponseEntity.ok(new ApiResponses.AccountListResponse(
                accountService.getSummary(ownerId),
                accountService.listAccounts(ownerId)));
    }

    @GetMapping("/{accountId}/entries")
    @Operation(summary = "Ledger entries", description = "Real ledger legs of the account, newest first")
    public ResponseEntity<List<ApiResponses.EntryResponse>> getEntries(
            @Parameter(description = "Account ID") @PathVariable UUID accountId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        List<ApiResponses.EntryResponse> responses = ledgerService.getEntries(accountId, pageRequest)
                .stream()
                .map(ApiResponses.EntryResponse::new)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MOVEMENTS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     * - 200 OK          → deposit ledgered, returns the credit leg
     * - 400 Bad Request → non-positive amount or below the minimum
     * - 404 Not Found   → no such account
     */
    @PostMapping("/{accountId}/deposit")
    @Operation(summary = "Deposit funds", description = "Credit money into an account")
    public ResponseEntity<ApiResponses.MovementResponse> deposit(
            @Parameter(description = "Account ID") @PathVariable UUID accountId,
            @Valid @RequestBody TransactionRequest request) {

        MovementRecord record = ledgerService.deposit(accountId, request.getAmount(), request.getDescription());
        return ResponseEntity.ok(new ApiResponses.MovementResponse(record));
    }

    /**
     * HTTP Contract:
     * - 200 OK          → withdrawal ledgered, returns the debit leg
     * - 400 Bad Request → invalid amount or above the withdrawal limit
     * - 409 Conflict    → insufficient funds
     */
    @PostMapping("/{accountId}/withdraw")
    @Operation(summary = "Withdraw funds", description = "Debit money from an account")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Withdrawal successful"),
        @ApiResponse(responseCode = "400", description = "Invalid amount"),
        @ApiResponse(responseCode = "409", description = "Insufficient funds")
    })
    public ResponseEntity<ApiResponses.MovementResponse> withdraw(
            @Parameter(description = "Account ID") @PathVariable UUID accountId,
            @Valid @RequestBody TransactionRequest request) {

        MovementRecord record = ledgerService.withdraw(accountId, request.getAmount(), request.getDescription());
        return ResponseEntity.ok(new ApiResponses.MovementResponse(record));
    }

    /**
     * HTTP Contract:
     * - 200 OK          → both legs written in one group
     * - 409 Conflict    → insufficient funds on the source account
     * - 422             → source and destination are the same account
     */
    @PostMapping("/{accountId}/transfer")
    @Operation(summary = "Transfer funds", description = "Atomically debit this account and credit another")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transfer complete"),
        @ApiResponse(responseCode = "400", description = "Invalid input"),
        @ApiResponse(responseCode = "409", description = "Insufficient funds"),
        @ApiResponse(responseCode = "422", description = "Transfer to the same account")
    })
    public ResponseEntity<ApiResponses.TransferResponse> transfer(
            @Parameter(description = "Source account ID") @PathVariable UUID accountId,
            @Valid @RequestBody TransferRequest request) {

        TransferResult result = ledgerService.transfer(
                accountId,
                request.getToAccountId(),
                request.getAmount(),
                request.getDescription());
        return ResponseEntity.ok(new ApiResponses.TransferResponse(result));
    }
}
