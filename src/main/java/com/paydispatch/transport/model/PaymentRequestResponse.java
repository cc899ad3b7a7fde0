package com.paydispatch.transport.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentRequestResponse(
        String correlationId,
        BigDecimal amount,
        Instant requestedAt
) {
}
