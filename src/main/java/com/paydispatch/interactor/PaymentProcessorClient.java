package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;
import com.paydispatch.entity.Processor;

public interface PaymentProcessorClient {

    /**
     * @return {@code true} only if the processor confirmed the payment
     */
    boolean submit(Processor processor, Payment payment);

    /**
     * @return {@code true} only if the health endpoint answered and reported not failing
     */
    boolean checkHealth(Processor processor);
}
