package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for depositing currency into the vault.
 */
@Data
public class DepositRequest {

    /**
     * Amount in the currency's smallest unit.
     */
    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}
