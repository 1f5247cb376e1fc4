package com.subradar.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/known-merchants request body. With save=true the table is written to the overlay file.
 */
public record AddKnownMerchantRequest(
        @NotBlank(message = "INVALID_KNOWN_MERCHANT")
        String name,

        @NotBlank(message = "INVALID_KNOWN_MERCHANT")
        String url,

        boolean save
) {
}
