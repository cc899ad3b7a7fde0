package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;
import com.paydispatch.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public final class SettlementService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final PaymentRouter router;
    private final ThreadPoolExecutor executor;

    public SettlementService(PaymentRouter router, int threads, int queueCapacity) {
        this.router = Objects.requireNonNull(router, "router");
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), new DaemonThreadFactory("settlement-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    public boolean accept(Payment payment) {
        try {
            executor.execute(() -> settle(payment));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Settlement pool saturated, rejecting payment {}", payment.correlationId());
            return false;
        }
    }

    private void settle(Payment payment) {
        try {
            router.route(payment);
        } catch (RuntimeException e) {
            log.error("Unexpected failure settling payment {}", payment.correlationId(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
