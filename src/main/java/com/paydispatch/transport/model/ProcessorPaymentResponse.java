package com.paydispatch.transport.model;

public record ProcessorPaymentResponse(String message) {
}
