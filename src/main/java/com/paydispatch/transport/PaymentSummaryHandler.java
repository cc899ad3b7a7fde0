package com.paydispatch.transport;

import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.interactor.PaymentService;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

public class PaymentSummaryHandler {
    private static final Logger log = LoggerFactory.getLogger(PaymentSummaryHandler.class);

    private static final String POST = "POST";
    private static final String GET = "GET";

    private final PaymentService paymentService;

    public PaymentSummaryHandler(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    public void handlePaymentsSummary(HttpExchange exchange) throws IOException {
        if (!GET.equals(exchange.getRequestMethod())) {
            HttpResponseHelper.sendMethodNotAllowed(exchange);
            return;
        }

        try {
            Map<String, String> queryParams = RequestParser.parseQueryParams(exchange.getRequestURI().getRawQuery());

            Instant from = RequestParser.parseFlexibleTime(queryParams.get("from"));
            Instant to = RequestParser.parseFlexibleTime(queryParams.get("to"));

            RequestParser.validateTimeRange(from, to);

            PaymentSummary summary = (from != null || to != null)
                    ? paymentService.getPaymentsSummary(from, to)
                    : paymentService.getPaymentsSummary();

            byte[] jsonBytes = JsonUtils.toPaymentSummaryJsonBytes(summary);
            HttpResponseHelper.sendJsonResponse(exchange, 200, jsonBytes);
        } catch (IllegalArgumentException e) {
            HttpResponseHelper.sendErrorResponse(exchange, 400, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to build payment summary", e);
            HttpResponseHelper.sendInternalError(exchange);
        }
    }

    public void handlePurgePayments(HttpExchange exchange) throws IOException {
        if (!POST.equals(exchange.getRequestMethod())) {
            HttpResponseHelper.sendMethodNotAllowed(exchange);
            return;
        }

        try {
            paymentService.purgeAllData();
            HttpResponseHelper.sendPurgeSuccess(exchange);
        } catch (RuntimeException e) {
            log.error("Failed to purge payments", e);
            HttpResponseHelper.sendInternalError(exchange);
        }
    }

    public void handleHealthz(HttpExchange exchange) throws IOException {
        HttpResponseHelper.sendOk(exchange);
    }
}
