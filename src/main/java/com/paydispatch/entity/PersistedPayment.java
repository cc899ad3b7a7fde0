package com.paydispatch.entity;

import java.math.BigDecimal;
import java.time.Instant;

public record PersistedPayment(
        String correlationId,
        BigDecimal amount,
        Processor processor,
        Instant createdAt
) {
}
