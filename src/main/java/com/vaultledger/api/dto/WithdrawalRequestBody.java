package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for queueing a withdrawal.
 */
@Data
public class WithdrawalRequestBody {

    @NotNull(message = "Shares are required")
    @Positive(message = "Shares must be positive")
    private BigInteger shares;
}
