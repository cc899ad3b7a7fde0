package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.Processor;
import com.paydispatch.entity.SettlementOutcome;
import com.paydispatch.support.FakeProcessorClient;
import com.paydispatch.support.InMemoryPaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentRouterTest {

    private InMemoryPaymentRepository repository;
    private FakeProcessorClient client;
    private ProcessorHealth health;
    private PaymentRouter router;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPaymentRepository();
        client = new FakeProcessorClient();
        health = new ProcessorHealth();
        router = new PaymentRouter(repository, health, client);
    }

    private static Payment payment(String id, String amount) {
        return new Payment(id, new BigDecimal(amount));
    }

    @Test
    void healthyDefaultSettles() {
        SettlementOutcome outcome = router.route(payment("A", "10.00"));

        assertEquals(SettlementOutcome.settled(Processor.DEFAULT), outcome);
        PaymentSummary summary = repository.getPaymentsSummary(null, null);
        assertEquals(1, summary.defaultProcessor().totalRequests());
        assertEquals(0, new BigDecimal("10.00").compareTo(summary.defaultProcessor().totalAmount()));
        assertEquals(0, summary.fallback().totalRequests());
        assertTrue(client.submissions(Processor.FALLBACK).isEmpty());
    }

    @Test
    void unhealthyDefaultGoesStraightToFallback() {
        health.update(Processor.DEFAULT, false, Instant.now());

        SettlementOutcome outcome = router.route(payment("B", "5.00"));

        assertEquals(SettlementOutcome.settled(Processor.FALLBACK), outcome);
        assertTrue(client.submissions(Processor.DEFAULT).isEmpty());
        assertEquals(List.of("B"), client.submissions(Processor.FALLBACK));
    }

    @Test
    void rejectedByDefaultFailsOverOnce() {
        client.accepting(Processor.DEFAULT, false);

        SettlementOutcome outcome = router.route(payment("C", "7.25"));

        assertEquals(SettlementOutcome.settled(Processor.FALLBACK), outcome);
        assertEquals(List.of("C"), client.submissions(Processor.DEFAULT));
        assertEquals(List.of("C"), client.submissions(Processor.FALLBACK));
    }

    @Test
    void bothFailingDropsWithoutWriting() {
        client.accepting(Processor.DEFAULT, false).accepting(Processor.FALLBACK, false);

        SettlementOutcome outcome = router.route(payment("D", "3.00"));

        assertEquals(SettlementOutcome.Status.DROPPED, outcome.status());
        assertEquals(0, repository.paymentCount());
        assertEquals(1, client.submissions(Processor.DEFAULT).size());
        assertEquals(1, client.submissions(Processor.FALLBACK).size());
    }

    @Test
    void noHealthyProcessorDropsWithoutCalls() {
        health.update(Processor.DEFAULT, false, Instant.now());
        health.update(Processor.FALLBACK, false, Instant.now());

        SettlementOutcome outcome = router.route(payment("E", "1.00"));

        assertEquals(SettlementOutcome.Status.DROPPED, outcome.status());
        assertTrue(client.submissions(Processor.DEFAULT).isEmpty());
        assertTrue(client.submissions(Processor.FALLBACK).isEmpty());
    }

    @Test
    void sameCorrelationIdSettlesOnce() {
        assertEquals(SettlementOutcome.Status.SETTLED, router.route(payment("A", "10.00")).status());
        assertEquals(SettlementOutcome.Status.ALREADY_SETTLED, router.route(payment("A", "10.00")).status());

        assertEquals(1, client.submissions(Processor.DEFAULT).size());
        assertEquals(1, repository.getPaymentsSummary(null, null).defaultProcessor().totalRequests());
    }

    @Test
    void storeReadFailureDropsBeforeCallingProcessors() {
        repository.failReads(true);

        assertEquals(SettlementOutcome.Status.DROPPED, router.route(payment("F", "2.00")).status());
        assertTrue(client.submissions(Processor.DEFAULT).isEmpty());
    }

    @Test
    void storeWriteFailureAfterSettlementIsReportedUnrecorded() {
        repository.failWrites(true);

        SettlementOutcome outcome = router.route(payment("G", "2.00"));

        assertEquals(SettlementOutcome.unrecorded(Processor.DEFAULT), outcome);
        assertEquals(0, repository.paymentCount());
    }

    @Test
    void purgeMakesCorrelationIdSettleableAgain() {
        router.route(payment("H", "4.00"));
        repository.purgeAllData();

        assertEquals(SettlementOutcome.Status.SETTLED, router.route(payment("H", "4.00")).status());
        assertEquals(2, client.submissions(Processor.DEFAULT).size());
    }
}
