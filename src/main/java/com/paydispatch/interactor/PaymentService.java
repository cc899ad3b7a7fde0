package com.paydispatch.interactor;

import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public class PaymentService {
    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRepository repository;

    public PaymentService(PaymentRepository repository) {
        this.repository = repository;
    }

    public PaymentSummary getPaymentsSummary() {
        return repository.getPaymentsSummary(null, null);
    }

    public PaymentSummary getPaymentsSummary(Instant from, Instant to) {
        return repository.getPaymentsSummary(from, to);
    }

    public void purgeAllData() {
        repository.purgeAllData();
        log.info("All payment data purged");
    }
}
