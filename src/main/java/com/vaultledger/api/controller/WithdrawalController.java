package com.vaultledger.api.controller;

import com.vaultledger.api.dto.WithdrawalRequestBody;
import com.vaultledger.ledger.LedgerEntry;
import com.vaultledger.ledger.LedgerService;
import com.vaultledger.withdrawal.FulfillmentResult;
import com.vaultledger.withdrawal.WithdrawalQueueService;
import com.vaultledger.withdrawal.WithdrawalRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the withdrawal queue.
 */
@RestController
@RequestMapping("/api/v1/withdrawals")
@RequiredArgsConstructor
@Tag(name = "Withdrawals", description = "Escrowed FIFO withdrawal queue")
public class WithdrawalController {

    private final WithdrawalQueueService withdrawalQueueService;
    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Escrow shares and queue a withdrawal")
    public ResponseEntity<WithdrawalRequest> requestWithdrawal(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody WithdrawalRequestBody request) {
        long requestId = withdrawalQueueService.requestWithdrawal(caller, request.getShares());
        return ResponseEntity.status(HttpStatus.CREATED).body(withdrawalQueueService.getRequest(requestId));
    }

    @DeleteMapping("/{requestId}")
    @Operation(summary = "Cancel a pending withdrawal and return the escrowed shares")
    public ResponseEntity<Void> cancelWithdrawal(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable long requestId) {
        withdrawalQueueService.cancelWithdrawal(caller, requestId);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{requestId}")
    @Operation(summary = "Get a withdrawal request")
    public ResponseEntity<WithdrawalRequest> getRequest(@PathVariable long requestId) {
        return ResponseEntity.ok(withdrawalQueueService.getRequest(requestId));
    }

    @GetMapping("/{requestId}/journal")
    @Operation(summary = "Get ledger entries recorded for a withdrawal request")
    public ResponseEntity<List<LedgerEntry>> getRequestJournal(@PathVariable long requestId) {
        return ResponseEntity.ok(ledgerService.getRequestJournal(requestId));
    }

    @GetMapping("/holder/{holder}")
    @Operation(summary = "Get all withdrawal requests of a holder")
    public ResponseEntity<List<WithdrawalRequest>> getRequestsForHolder(@PathVariable String holder) {
        return ResponseEntity.ok(withdrawalQueueService.getRequestsForHolder(holder));
    }

    @PostMapping("/fulfill")
    @Operation(summary = "Fulfill matured requests from the head of the queue")
    public ResponseEntity<FulfillmentResult> fulfill(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestParam(defaultValue = "10") int count) {
        return ResponseEntity.ok(withdrawalQueueService.fulfillWithdrawals(caller, count));
    }

    @PostMapping("/purge")
    @Operation(summary = "Delete resolved requests behind the queue head")
    public ResponseEntity<Map<String, Integer>> purge(@RequestParam(defaultValue = "100") int maxCount) {
        int purged = withdrawalQueueService.purgeProcessedWithdrawals(maxCount);
        return ResponseEntity.ok(Map.of("purged", purged));
    }
}
