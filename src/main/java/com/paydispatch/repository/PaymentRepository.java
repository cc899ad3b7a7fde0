package com.paydispatch.repository;

import com.paydispatch.entity.AuditEntry;
import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.PersistedPayment;
import com.paydispatch.entity.Processor;

import java.io.Closeable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of settled payments. The row keyed by correlationId is the only
 * authority on whether a payment has been settled; every implementation must make
 * {@link #saveIfAbsent} a single atomic conditional write.
 *
 * <p>Methods throw {@link PaymentRepositoryException} when the store cannot be reached.
 */
public interface PaymentRepository extends Closeable {

    /**
     * Records a settled payment unless a row with the same correlationId exists.
     *
     * @return {@code true} if this call inserted the row
     */
    boolean saveIfAbsent(Payment payment, Processor processor);

    Optional<PersistedPayment> findByCorrelationId(String correlationId);

    /**
     * Totals per processor over the rows committed at query time. A {@code null}
     * bound leaves that side of the window open.
     */
    PaymentSummary getPaymentsSummary(Instant from, Instant to);

    void purgeAllData();

    /**
     * Appends raw submissions to the compliance log, skipping correlationIds already there.
     *
     * @return number of entries actually written
     */
    int appendAuditLog(List<AuditEntry> entries);

    void verifyConnectivity();

    @Override
    void close();
}
