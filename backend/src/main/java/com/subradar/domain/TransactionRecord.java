package com.subradar.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One parsed statement line: booking date, raw merchant text and signed amount.
 * Produced by the statement parsing collaborator; malformed lines never reach the engine.
 */
public record TransactionRecord(LocalDate date, String merchant, BigDecimal amount) {

    public TransactionRecord {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(amount, "amount");
        merchant = merchant != null ? merchant : "";
    }

    public static TransactionRecord of(String isoDate, String merchant, String amount) {
        return new TransactionRecord(LocalDate.parse(isoDate), merchant, new BigDecimal(amount));
    }
}
