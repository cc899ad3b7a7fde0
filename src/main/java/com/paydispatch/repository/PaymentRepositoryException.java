package com.paydispatch.repository;

public class PaymentRepositoryException extends RuntimeException {

    public PaymentRepositoryException(String message) {
        super(message);
    }

    public PaymentRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
