package com.vaultledger.api.controller;

import com.vaultledger.api.dto.DepositRequest;
import com.vaultledger.api.dto.TransferSharesRequest;
import com.vaultledger.deposit.DepositReceipt;
import com.vaultledger.deposit.DepositService;
import com.vaultledger.ledger.AccountView;
import com.vaultledger.ledger.LedgerEntry;
import com.vaultledger.ledger.ShareTransferService;
import com.vaultledger.ledger.VaultQueryService;
import com.vaultledger.ledger.VaultSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * REST API for deposits, share transfers and vault views.
 */
@RestController
@RequestMapping("/api/v1/vault")
@RequiredArgsConstructor
@Tag(name = "Vault", description = "Deposits, balances and pricing")
public class VaultController {

    private final DepositService depositService;
    private final ShareTransferService shareTransferService;
    private final VaultQueryService vaultQueryService;

    @GetMapping("/summary")
    @Operation(summary = "Get NAV, share price, queue state and parameters")
    public ResponseEntity<VaultSummary> getSummary() {
        return ResponseEntity.ok(vaultQueryService.getSummary());
    }

    @GetMapping("/accounts/{holder}")
    @Operation(summary = "Get a holder's share balance and its current value")
    public ResponseEntity<AccountView> getAccount(@PathVariable String holder) {
        return ResponseEntity.ok(vaultQueryService.getAccount(holder));
    }

    @GetMapping("/accounts/{holder}/journal")
    @Operation(summary = "Get ledger entries for a holder")
    public ResponseEntity<List<LedgerEntry>> getJournal(@PathVariable String holder) {
        return ResponseEntity.ok(vaultQueryService.getJournal(holder));
    }

    @GetMapping("/convert/shares-to-value")
    @Operation(summary = "Value of a share amount at the current price")
    public ResponseEntity<BigInteger> convertToValue(@RequestParam BigInteger shares) {
        return ResponseEntity.ok(vaultQueryService.convertToValue(shares));
    }

    @GetMapping("/convert/value-to-shares")
    @Operation(summary = "Shares a value amount buys at the current price")
    public ResponseEntity<BigInteger> convertToShares(@RequestParam BigInteger value) {
        return ResponseEntity.ok(vaultQueryService.convertToShares(value));
    }

    @PostMapping("/deposit")
    @Operation(summary = "Deposit currency and receive shares")
    public ResponseEntity<DepositReceipt> deposit(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody DepositRequest request) {
        DepositReceipt receipt = depositService.deposit(caller, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/transfer")
    @Operation(summary = "Transfer shares to another holder")
    public ResponseEntity<Void> transfer(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody TransferSharesRequest request) {
        shareTransferService.transferShares(caller, request.getTo(), request.getShares());
        return ResponseEntity.ok().build();
    }
}
