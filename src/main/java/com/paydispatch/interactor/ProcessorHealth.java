package com.paydispatch.interactor;

import com.paydispatch.entity.Processor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

public final class ProcessorHealth {

    public record Status(boolean healthy, Instant lastCheckedAt) {
    }

    private final Map<Processor, AtomicReference<Status>> statuses = new EnumMap<>(Processor.class);

    public ProcessorHealth() {
        for (Processor processor : Processor.values()) {
            statuses.put(processor, new AtomicReference<>(new Status(true, null)));
        }
    }

    public boolean isHealthy(Processor processor) {
        return status(processor).healthy();
    }

    public Status status(Processor processor) {
        return statuses.get(processor).get();
    }

    Status update(Processor processor, boolean healthy, Instant checkedAt) {
        return statuses.get(processor).getAndSet(new Status(healthy, checkedAt));
    }
}
