package com.paydispatch.transport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paydispatch.entity.PaymentSummary;

import java.math.BigDecimal;

@JsonPropertyOrder({"default", "fallback"})
public record PaymentSummaryResponse(
        @JsonProperty("default") Totals defaultProcessor,
        @JsonProperty("fallback") Totals fallback
) {

    public static PaymentSummaryResponse from(PaymentSummary summary) {
        return new PaymentSummaryResponse(Totals.from(summary.defaultProcessor()), Totals.from(summary.fallback()));
    }

    @JsonPropertyOrder({"totalRequests", "totalAmount"})
    public record Totals(long totalRequests, BigDecimal totalAmount) {

        static Totals from(PaymentSummary.ProcessorSummary summary) {
            return new Totals(summary.totalRequests(), summary.totalAmount());
        }
    }
}
