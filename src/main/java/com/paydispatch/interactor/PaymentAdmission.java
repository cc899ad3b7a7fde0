package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;

import java.util.Objects;

public class PaymentAdmission {

    public enum Result {
        ACCEPTED,
        QUEUE_FULL
    }

    private final PaymentQueue queue;
    private final ComplianceLog complianceLog;

    public PaymentAdmission(PaymentQueue queue, ComplianceLog complianceLog) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.complianceLog = complianceLog;
    }

    public Result admit(Payment payment) {
        if (!queue.offer(payment)) {
            return Result.QUEUE_FULL;
        }
        if (complianceLog != null) {
            complianceLog.record(payment);
        }
        return Result.ACCEPTED;
    }
}
