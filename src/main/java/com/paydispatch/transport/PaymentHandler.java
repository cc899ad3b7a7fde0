package com.paydispatch.transport;

import com.paydispatch.entity.Payment;
import com.paydispatch.interactor.PaymentAdmission;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class PaymentHandler {
    private static final Logger log = LoggerFactory.getLogger(PaymentHandler.class);

    private static final String POST = "POST";

    private final PaymentAdmission admission;

    public PaymentHandler(PaymentAdmission admission) {
        this.admission = admission;
    }

    public void handlePayments(HttpExchange exchange) throws IOException {
        if (!POST.equals(exchange.getRequestMethod())) {
            HttpResponseHelper.sendMethodNotAllowed(exchange);
            return;
        }

        try {
            Payment payment;
            try {
                payment = JsonUtils.parsePaymentRequest(exchange.getRequestBody().readAllBytes());
            } catch (IllegalArgumentException e) {
                log.debug("Rejected payment body: {}", e.getMessage());
                HttpResponseHelper.sendInvalidRequest(exchange);
                return;
            }

            switch (admission.admit(payment)) {
                case ACCEPTED -> HttpResponseHelper.sendOk(exchange);
                case QUEUE_FULL -> HttpResponseHelper.sendServiceUnavailable(exchange);
            }
        } catch (RuntimeException e) {
            log.error("Failed to admit payment", e);
            HttpResponseHelper.sendInternalError(exchange);
        }
    }
}
