package com.vaultledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
public class ParameterUpdateRequest {

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    private BigInteger value;
}
