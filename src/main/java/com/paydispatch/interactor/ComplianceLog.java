package com.paydispatch.interactor;

import com.paydispatch.entity.AuditEntry;
import com.paydispatch.entity.Payment;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batches accepted submissions into the audit log off the request path. A full buffer
 * discards the entry.
 */
public final class ComplianceLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ComplianceLog.class);

    public static final int DEFAULT_BUFFER_CAPACITY = 4096;
    public static final int DEFAULT_BATCH_SIZE = 256;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(200);

    private final PaymentRepository repository;
    private final BlockingQueue<AuditEntry> buffer;
    private final int batchSize;
    private final long flushIntervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Thread flusher;

    public ComplianceLog(PaymentRepository repository) {
        this(repository, DEFAULT_BUFFER_CAPACITY, DEFAULT_BATCH_SIZE, DEFAULT_FLUSH_INTERVAL);
    }

    public ComplianceLog(PaymentRepository repository, int bufferCapacity, int batchSize, Duration flushInterval) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.repository = Objects.requireNonNull(repository, "repository");
        this.buffer = new ArrayBlockingQueue<>(bufferCapacity);
        this.batchSize = batchSize;
        this.flushIntervalMs = flushInterval.toMillis();
        this.flusher = new DaemonThreadFactory("compliance-log-").newThread(this::flushLoop);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            flusher.start();
        }
    }

    /**
     * @return {@code false} if the buffer was full and the entry was discarded
     */
    public boolean record(Payment payment) {
        return buffer.offer(AuditEntry.of(payment));
    }

    private void flushLoop() {
        List<AuditEntry> batch = new ArrayList<>(batchSize);
        try {
            while (running.get()) {
                AuditEntry first = buffer.poll(flushIntervalMs, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                collect(batch, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(flushIntervalMs));
                flush(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!batch.isEmpty()) {
                flush(batch);
            }
        }
    }

    private void collect(List<AuditEntry> batch, long deadlineNanos) throws InterruptedException {
        while (batch.size() < batchSize) {
            buffer.drainTo(batch, batchSize - batch.size());
            if (batch.size() >= batchSize) {
                return;
            }
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            AuditEntry next = buffer.poll(remaining, TimeUnit.NANOSECONDS);
            if (next == null) {
                return;
            }
            batch.add(next);
        }
    }

    private void flush(List<AuditEntry> batch) {
        try {
            repository.appendAuditLog(batch);
        } catch (RuntimeException e) {
            log.warn("Failed to write {} audit entries", batch.size(), e);
        } finally {
            batch.clear();
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        flusher.interrupt();
        try {
            flusher.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        List<AuditEntry> batch = new ArrayList<>(batchSize);
        while (buffer.drainTo(batch, batchSize) > 0) {
            flush(batch);
        }
    }
}
