package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;
import com.paydispatch.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public final class DispatchWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchWorkerPool.class);

    private final PaymentQueue queue;
    private final PaymentForwarder forwarder;
    private final int workerCount;
    private final ExecutorService workers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public DispatchWorkerPool(PaymentQueue queue, PaymentForwarder forwarder, int workerCount) {
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
        this.queue = Objects.requireNonNull(queue, "queue");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.workerCount = workerCount;
        this.workers = workerCount > 0
                ? Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("dispatch-worker-"))
                : null;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (workers == null) {
            log.warn("workerCount=0: no dispatch workers started; queued payments will not be forwarded");
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Started {} dispatch workers", workerCount);
    }

    private void workerLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            Payment payment;
            try {
                payment = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                if (forwarder.forward(payment)) {
                    forwarded.incrementAndGet();
                } else {
                    dropped.incrementAndGet();
                    log.debug("Payment {} dropped at the forwarding hop", payment.correlationId());
                }
            } catch (RuntimeException e) {
                dropped.incrementAndGet();
                log.error("Dispatch worker failed on payment {}", payment.correlationId(), e);
            }
        }
    }

    public long forwardedCount() {
        return forwarded.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
