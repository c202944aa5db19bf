package com.vaultledger.api.dto;

import com.vaultledger.governance.TimelockedParameter;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for queueing a timelocked parameter change.
 *
 * Fee rates are 18-decimal integers, cooldown periods ISO-8601 durations,
 * treasury and custody venue plain identifiers.
 */
@Data
public class QueueParameterChangeRequest {

    @NotNull(message = "Parameter is required")
    private TimelockedParameter parameter;

    @NotBlank(message = "Value is required")
    private String value;
}
