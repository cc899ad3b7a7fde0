package com.paydispatch.entity;

import java.math.BigDecimal;
import java.time.Instant;

public record Payment(String correlationId, BigDecimal amount, Instant requestedAt) {
    public Payment {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be blank");
        }
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("amount must have at most 2 decimal places");
        }
        if (requestedAt == null) {
            requestedAt = Instant.now();
        }
    }

    public Payment(String correlationId, BigDecimal amount) {
        this(correlationId, amount, Instant.now());
    }
}
