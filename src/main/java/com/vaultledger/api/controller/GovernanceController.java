package com.vaultledger.api.controller;

import com.vaultledger.api.dto.QueueParameterChangeRequest;
import com.vaultledger.governance.PendingParameterChange;
import com.vaultledger.governance.TimelockService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for timelocked parameter changes.
 */
@RestController
@RequestMapping("/api/v1/governance/changes")
@RequiredArgsConstructor
@Tag(name = "Governance", description = "Timelocked parameter changes")
public class GovernanceController {

    private final TimelockService timelockService;

    @PostMapping
    @Operation(summary = "Queue a parameter change")
    public ResponseEntity<PendingParameterChange> queue(
            @RequestHeader(CallerHeader.NAME) String caller,
            @Valid @RequestBody QueueParameterChangeRequest request) {
        PendingParameterChange change = timelockService.queue(caller, request.getParameter(), request.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(change);
    }

    @GetMapping
    @Operation(summary = "List parameter changes, newest first")
    public ResponseEntity<List<PendingParameterChange>> list() {
        return ResponseEntity.ok(timelockService.list());
    }

    @PostMapping("/{changeId}/execute")
    @Operation(summary = "Execute a queued change after its delay")
    public ResponseEntity<PendingParameterChange> execute(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String changeId) {
        return ResponseEntity.ok(timelockService.execute(caller, changeId));
    }

    @DeleteMapping("/{changeId}")
    @Operation(summary = "Cancel a queued change")
    public ResponseEntity<PendingParameterChange> cancel(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String changeId) {
        return ResponseEntity.ok(timelockService.cancel(caller, changeId));
    }
}
