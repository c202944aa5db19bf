package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for reporting yield. Negative values report a loss.
 */
@Data
public class YieldReportRequest {

    @NotNull(message = "Delta is required")
    private BigInteger delta;
}
