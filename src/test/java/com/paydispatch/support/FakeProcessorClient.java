package com.paydispatch.support;

import com.paydispatch.entity.Payment;
import com.paydispatch.entity.Processor;
import com.paydispatch.interactor.PaymentProcessorClient;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable processor pair: each side can be told to report unhealthy or to reject payments.
 */
public class FakeProcessorClient implements PaymentProcessorClient {

    private final Map<Processor, AtomicBoolean> healthy = new EnumMap<>(Processor.class);
    private final Map<Processor, AtomicBoolean> accepting = new EnumMap<>(Processor.class);
    private final Map<Processor, AtomicInteger> healthChecks = new EnumMap<>(Processor.class);
    private final Map<Processor, List<String>> submissions = new EnumMap<>(Processor.class);

    public FakeProcessorClient() {
        for (Processor processor : Processor.values()) {
            healthy.put(processor, new AtomicBoolean(true));
            accepting.put(processor, new AtomicBoolean(true));
            healthChecks.put(processor, new AtomicInteger());
            submissions.put(processor, new CopyOnWriteArrayList<>());
        }
    }

    public FakeProcessorClient healthy(Processor processor, boolean value) {
        healthy.get(processor).set(value);
        return this;
    }

    public FakeProcessorClient accepting(Processor processor, boolean value) {
        accepting.get(processor).set(value);
        return this;
    }

    public List<String> submissions(Processor processor) {
        return List.copyOf(submissions.get(processor));
    }

    public int healthChecks(Processor processor) {
        return healthChecks.get(processor).get();
    }

    @Override
    public boolean submit(Processor processor, Payment payment) {
        submissions.get(processor).add(payment.correlationId());
        return accepting.get(processor).get();
    }

    @Override
    public boolean checkHealth(Processor processor) {
        healthChecks.get(processor).incrementAndGet();
        return healthy.get(processor).get();
    }
}
