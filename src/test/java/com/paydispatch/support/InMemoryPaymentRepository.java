package com.paydispatch.support;

import com.paydispatch.entity.AuditEntry;
import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.PersistedPayment;
import com.paydispatch.entity.Processor;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.repository.PaymentRepositoryException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed store for unit tests, with switches to simulate store outages.
 */
public class InMemoryPaymentRepository implements PaymentRepository {

    private final Map<String, PersistedPayment> payments = new ConcurrentHashMap<>();
    private final List<AuditEntry> auditLog = new CopyOnWriteArrayList<>();
    private final AtomicBoolean readsFail = new AtomicBoolean(false);
    private final AtomicBoolean writesFail = new AtomicBoolean(false);
    private final AtomicBoolean auditFails = new AtomicBoolean(false);
    private final AtomicInteger auditBatches = new AtomicInteger();
    private final AtomicInteger auditFailures = new AtomicInteger();

    public void failReads(boolean fail) {
        readsFail.set(fail);
    }

    public void failWrites(boolean fail) {
        writesFail.set(fail);
    }

    public void failAudit(boolean fail) {
        auditFails.set(fail);
    }

    public int paymentCount() {
        return payments.size();
    }

    public List<AuditEntry> auditLog() {
        return List.copyOf(auditLog);
    }

    public int auditBatches() {
        return auditBatches.get();
    }

    public int auditFailures() {
        return auditFailures.get();
    }

    @Override
    public boolean saveIfAbsent(Payment payment, Processor processor) {
        if (writesFail.get()) {
            throw new PaymentRepositoryException("simulated write failure");
        }
        PersistedPayment row = new PersistedPayment(payment.correlationId(), payment.amount(), processor, Instant.now());
        return payments.putIfAbsent(payment.correlationId(), row) == null;
    }

    @Override
    public Optional<PersistedPayment> findByCorrelationId(String correlationId) {
        if (readsFail.get()) {
            throw new PaymentRepositoryException("simulated read failure");
        }
        return Optional.ofNullable(payments.get(correlationId));
    }

    @Override
    public PaymentSummary getPaymentsSummary(Instant from, Instant to) {
        long defaultCount = 0;
        long fallbackCount = 0;
        BigDecimal defaultAmount = BigDecimal.ZERO;
        BigDecimal fallbackAmount = BigDecimal.ZERO;
        for (PersistedPayment row : new ArrayList<>(payments.values())) {
            if ((from != null && row.createdAt().isBefore(from)) || (to != null && row.createdAt().isAfter(to))) {
                continue;
            }
            if (row.processor() == Processor.DEFAULT) {
                defaultCount++;
                defaultAmount = defaultAmount.add(row.amount());
            } else {
                fallbackCount++;
                fallbackAmount = fallbackAmount.add(row.amount());
            }
        }
        return new PaymentSummary(
                new PaymentSummary.ProcessorSummary(defaultCount, defaultAmount),
                new PaymentSummary.ProcessorSummary(fallbackCount, fallbackAmount));
    }

    @Override
    public void purgeAllData() {
        payments.clear();
        auditLog.clear();
    }

    @Override
    public int appendAuditLog(List<AuditEntry> entries) {
        if (auditFails.get()) {
            auditFailures.incrementAndGet();
            throw new PaymentRepositoryException("simulated audit failure");
        }
        auditBatches.incrementAndGet();
        auditLog.addAll(entries);
        return entries.size();
    }

    @Override
    public void verifyConnectivity() {
    }

    @Override
    public void close() {
    }
}
