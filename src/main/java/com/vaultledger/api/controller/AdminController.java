package com.vaultledger.api.controller;

import com.vaultledger.access.AccessAuthority;
import com.vaultledger.api.dto.ParameterUpdateRequest;
import com.vaultledger.api.dto.YieldReportRequest;
import com.vaultledger.fees.YieldReport;
import com.vaultledger.fees.YieldService;
import com.vaultledger.governance.ParameterService;
import com.vaultledger.withdrawal.WithdrawalQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

/**
 * REST API for owner and operator actions.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Yield reporting, emergency paths, parameters and pause controls")
public class AdminController {

    private final YieldService yieldService;
    private final WithdrawalQueueService withdrawalQueueService;
    private final ParameterService parameterService;
    private final AccessAuthority accessAuthority;

    @PostMapping("/yield")
    @Operation(summary = "Report yield and collect the performance fee")
    public ResponseEntity<YieldReport> reportYield(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody YieldReportRequest request) {
        return ResponseEntity.ok(yieldService.reportYieldAndCollectFees(caller, request.getDelta()));
    }

    @PostMapping("/hwm/reset")
    @Operation(summary = "Reset the price high-water mark to the current price")
    public ResponseEntity<Map<String, BigInteger>> resetHighWaterMark(@RequestHeader(CallerHeader.NAME) String caller) {
        return ResponseEntity.ok(Map.of("priceHighWaterMark", yieldService.resetPriceHWM(caller)));
    }

    @PostMapping("/withdrawals/{requestId}/force")
    @Operation(summary = "Settle one withdrawal regardless of queue order and cooldown")
    public ResponseEntity<Map<String, BigInteger>> forceProcess(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable long requestId) {
        return ResponseEntity.ok(Map.of("payout", withdrawalQueueService.forceProcessWithdrawal(caller, requestId)));
    }

    @PostMapping("/escrow/recover-orphaned")
    @Operation(summary = "Burn escrowed shares not backing any pending request")
    public ResponseEntity<Map<String, BigInteger>> recoverOrphaned(@RequestHeader(CallerHeader.NAME) String caller) {
        return ResponseEntity.ok(Map.of("burned", withdrawalQueueService.recoverOrphanedShares(caller)));
    }

    @PutMapping("/parameters/per-user-cap")
    @Operation(summary = "Set the per-holder value cap (0 = unlimited)")
    public ResponseEntity<Void> setPerUserCap(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody ParameterUpdateRequest request) {
        parameterService.setPerUserCap(caller, request.getValue());
        return ResponseEntity.ok().build();
    }

    @PutMapping("/parameters/global-cap")
    @Operation(summary = "Set the total assets cap (0 = unlimited)")
    public ResponseEntity<Void> setGlobalCap(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody ParameterUpdateRequest request) {
        parameterService.setGlobalCap(caller, request.getValue());
        return ResponseEntity.ok().build();
    }

    @PutMapping("/parameters/liquidity-buffer")
    @Operation(summary = "Set the liquidity buffer kept out of the custody venue")
    public ResponseEntity<Void> setLiquidityBuffer(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody ParameterUpdateRequest request) {
        parameterService.setLiquidityBuffer(caller, request.getValue());
        return ResponseEntity.ok().build();
    }

    @PutMapping("/parameters/max-yield-change")
    @Operation(summary = "Set the per-report yield bound as an 18-decimal fraction of NAV")
    public ResponseEntity<Void> setMaxYieldChange(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody ParameterUpdateRequest request) {
        parameterService.setMaxYieldChangePercent(caller, request.getValue());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause/ledger")
    @Operation(summary = "Pause or unpause all deposits and withdrawals")
    public ResponseEntity<Void> pauseLedger(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestParam boolean paused) {
        accessAuthority.setPaused(caller, paused);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause/deposits")
    @Operation(summary = "Pause or unpause deposits")
    public ResponseEntity<Void> pauseDeposits(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestParam boolean paused) {
        accessAuthority.setDepositsPaused(caller, paused);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause/withdrawals")
    @Operation(summary = "Pause or unpause withdrawal requests and fulfillment")
    public ResponseEntity<Void> pauseWithdrawals(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestParam boolean paused) {
        accessAuthority.setWithdrawalsPaused(caller, paused);
        return ResponseEntity.ok().build();
    }
}
