package com.paydispatch.entity;

import java.math.BigDecimal;
import java.time.Instant;

public record AuditEntry(String correlationId, BigDecimal amount, Instant receivedAt) {

    public static AuditEntry of(Payment payment) {
        return new AuditEntry(payment.correlationId(), payment.amount(), payment.requestedAt());
    }
}
