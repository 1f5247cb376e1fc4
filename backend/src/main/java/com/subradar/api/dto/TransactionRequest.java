package com.subradar.api.dto;

import com.subradar.domain.TransactionRecord;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One statement line. Merchant may be empty text but must be present.
 */
public record TransactionRequest(
        @NotNull(message = "INVALID_TRANSACTION")
        LocalDate date,

        @NotNull(message = "INVALID_TRANSACTION")
        String merchant,

        @NotNull(message = "INVALID_TRANSACTION")
        BigDecimal amount
) {

    public TransactionRecord toRecord() {
        return new TransactionRecord(date, merchant, amount);
    }
}
