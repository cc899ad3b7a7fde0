package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;

public interface PaymentForwarder {

    boolean forward(Payment payment);
}
