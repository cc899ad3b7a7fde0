package com.paydispatch.transport;

import com.paydispatch.entity.Payment;
import com.paydispatch.interactor.PaymentForwarder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class HttpPaymentForwarder implements PaymentForwarder {
    private static final Logger log = LoggerFactory.getLogger(HttpPaymentForwarder.class);

    private static final String CONTENT_TYPE_HEADER = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private final HttpClient httpClient;
    private final URI processPaymentUri;
    private final Duration timeout;

    public HttpPaymentForwarder(URI workerUrl, Duration timeout) {
        this.processPaymentUri = HttpPaymentProcessorClient.resolve(workerUrl, "/process-payment");
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public boolean forward(Payment payment) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(processPaymentUri)
                .header(CONTENT_TYPE_HEADER, APPLICATION_JSON)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(JsonUtils.toPaymentJsonBytes(payment)))
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                return true;
            }
            log.warn("Worker answered {} for payment {}", response.statusCode(), payment.correlationId());
            return false;
        } catch (IOException e) {
            log.warn("Could not forward payment {}: {}", payment.correlationId(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
