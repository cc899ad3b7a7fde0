package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;
import com.paydispatch.entity.Processor;
import com.paydispatch.entity.SettlementOutcome;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.repository.PaymentRepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Settles one submission: skips it if already recorded, tries the default processor and
 * then the fallback (each only while healthy, each at most once), and records the first
 * success. Anything that is not settled is dropped; there is no retry or dead-letter path.
 */
public class PaymentRouter {
    private static final Logger log = LoggerFactory.getLogger(PaymentRouter.class);

    private final PaymentRepository repository;
    private final ProcessorHealth health;
    private final PaymentProcessorClient client;

    public PaymentRouter(PaymentRepository repository, ProcessorHealth health, PaymentProcessorClient client) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.health = Objects.requireNonNull(health, "health");
        this.client = Objects.requireNonNull(client, "client");
    }

    public SettlementOutcome route(Payment payment) {
        String correlationId = payment.correlationId();
        try {
            if (repository.findByCorrelationId(correlationId).isPresent()) {
                log.debug("Payment {} already settled, skipping", correlationId);
                return SettlementOutcome.alreadySettled();
            }
        } catch (PaymentRepositoryException e) {
            log.error("Duplicate check failed for payment {}, dropping it", correlationId, e);
            return SettlementOutcome.dropped();
        }

        boolean attempted = false;
        for (Processor processor : Processor.values()) {
            if (!health.isHealthy(processor)) {
                log.debug("Skipping unhealthy {} processor for payment {}", processor.jsonName(), correlationId);
                continue;
            }
            attempted = true;
            if (client.submit(processor, payment)) {
                return record(payment, processor);
            }
            log.debug("Processor {} rejected payment {}", processor.jsonName(), correlationId);
        }

        if (attempted) {
            log.warn("Payment {} dropped: every healthy processor failed", correlationId);
        } else {
            log.warn("Payment {} dropped: no healthy processor", correlationId);
        }
        return SettlementOutcome.dropped();
    }

    private SettlementOutcome record(Payment payment, Processor processor) {
        try {
            if (repository.saveIfAbsent(payment, processor)) {
                log.debug("Payment {} settled with {}", payment.correlationId(), processor.jsonName());
                return SettlementOutcome.settled(processor);
            }
            log.warn("Payment {} was settled concurrently; {} result not recorded",
                    payment.correlationId(), processor.jsonName());
            return SettlementOutcome.alreadySettled();
        } catch (PaymentRepositoryException e) {
            log.error("Payment {} settled with {} but could not be recorded",
                    payment.correlationId(), processor.jsonName(), e);
            return SettlementOutcome.unrecorded(processor);
        }
    }
}
