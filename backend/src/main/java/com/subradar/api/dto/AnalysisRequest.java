package com.subradar.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /api/v1/analyses request body. Exclusions are raw merchant names or group keys.
 */
public record AnalysisRequest(
        @NotNull(message = "INVALID_TRANSACTION")
        List<@NotNull(message = "INVALID_TRANSACTION") @Valid TransactionRequest> transactions,

        List<String> exclusions
) {
}
