package com.paydispatch.interactor;

import com.paydispatch.entity.Processor;
import com.paydispatch.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class HealthTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final PaymentProcessorClient client;
    private final ProcessorHealth health;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probes;

    public HealthTracker(PaymentProcessorClient client, ProcessorHealth health, Duration interval) {
        this.client = Objects.requireNonNull(client, "client");
        this.health = Objects.requireNonNull(health, "health");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("health-checker-"));
        this.probes = Executors.newFixedThreadPool(Processor.values().length, new DaemonThreadFactory("health-probe-"));
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::safeProbe, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health checks every {} ms", interval.toMillis());
    }

    private void safeProbe() {
        try {
            probeAll();
        } catch (RuntimeException e) {
            log.error("Health check round failed", e);
        }
    }

    void probeAll() {
        Map<Processor, CompletableFuture<Boolean>> checks = new EnumMap<>(Processor.class);
        for (Processor processor : Processor.values()) {
            checks.put(processor, CompletableFuture.supplyAsync(() -> client.checkHealth(processor), probes));
        }

        for (Map.Entry<Processor, CompletableFuture<Boolean>> check : checks.entrySet()) {
            Processor processor = check.getKey();
            boolean healthy;
            try {
                healthy = check.getValue().join();
            } catch (CompletionException e) {
                log.warn("Health probe for {} failed", processor.jsonName(), e.getCause());
                healthy = false;
            }
            ProcessorHealth.Status previous = health.update(processor, healthy, Instant.now());
            if (previous.healthy() != healthy) {
                log.info("Processor {} is now {}", processor.jsonName(), healthy ? "healthy" : "unhealthy");
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        probes.shutdownNow();
    }
}
