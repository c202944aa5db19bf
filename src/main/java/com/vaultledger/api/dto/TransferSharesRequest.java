package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for sending shares to another holder.
 */
@Data
public class TransferSharesRequest {

    @NotBlank(message = "Recipient is required")
    private String to;

    @NotNull(message = "Shares are required")
    @Positive(message = "Shares must be positive")
    private BigInteger shares;
}
