package com.paydispatch.entity;

import java.math.BigDecimal;

public record PaymentSummary(
        ProcessorSummary defaultProcessor,
        ProcessorSummary fallback
) {
    public static final PaymentSummary EMPTY = new PaymentSummary(ProcessorSummary.EMPTY, ProcessorSummary.EMPTY);

    public ProcessorSummary forProcessor(Processor processor) {
        return processor == Processor.DEFAULT ? defaultProcessor : fallback;
    }

    public record ProcessorSummary(
            long totalRequests,
            BigDecimal totalAmount
    ) {
        public static final ProcessorSummary EMPTY = new ProcessorSummary(0, BigDecimal.ZERO);

        public ProcessorSummary {
            if (totalAmount == null || totalAmount.signum() == 0) {
                totalAmount = BigDecimal.ZERO;
            }
        }
    }
}
