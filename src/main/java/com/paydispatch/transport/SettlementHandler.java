package com.paydispatch.transport;

import com.paydispatch.entity.Payment;
import com.paydispatch.interactor.SettlementService;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class SettlementHandler {
    private static final Logger log = LoggerFactory.getLogger(SettlementHandler.class);

    private static final String POST = "POST";

    private final SettlementService settlementService;

    public SettlementHandler(SettlementService settlementService) {
        this.settlementService = settlementService;
    }

    public void handleProcessPayment(HttpExchange exchange) throws IOException {
        if (!POST.equals(exchange.getRequestMethod())) {
            HttpResponseHelper.sendMethodNotAllowed(exchange);
            return;
        }

        Payment payment;
        try {
            payment = JsonUtils.parseForwardedPayment(exchange.getRequestBody().readAllBytes());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected forwarded payment: {}", e.getMessage());
            HttpResponseHelper.sendInvalidRequest(exchange);
            return;
        }

        if (settlementService.accept(payment)) {
            HttpResponseHelper.sendOk(exchange);
        } else {
            HttpResponseHelper.sendServiceUnavailable(exchange);
        }
    }
}
