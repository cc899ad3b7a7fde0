package com.paydispatch.transport;

import com.paydispatch.entity.Payment;
import com.paydispatch.entity.Processor;
import com.paydispatch.interactor.PaymentProcessorClient;
import com.paydispatch.transport.model.ServiceHealthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class HttpPaymentProcessorClient implements PaymentProcessorClient {
    private static final Logger log = LoggerFactory.getLogger(HttpPaymentProcessorClient.class);

    static final String SUCCESS_MESSAGE = "payment processed successfully";

    private static final String CONTENT_TYPE_HEADER = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final Duration CONNECT_TIMEOUT = Duration.ofMillis(500);

    private final HttpClient httpClient;
    private final Map<Processor, URI> paymentUris = new EnumMap<>(Processor.class);
    private final Map<Processor, URI> healthUris = new EnumMap<>(Processor.class);
    private final Duration paymentTimeout;
    private final Duration healthCheckTimeout;

    public HttpPaymentProcessorClient(URI defaultBase, URI fallbackBase,
                                      Duration paymentTimeout, Duration healthCheckTimeout) {
        this.paymentTimeout = paymentTimeout;
        this.healthCheckTimeout = healthCheckTimeout;

        paymentUris.put(Processor.DEFAULT, resolve(defaultBase, "/payments"));
        paymentUris.put(Processor.FALLBACK, resolve(fallbackBase, "/payments"));
        healthUris.put(Processor.DEFAULT, resolve(defaultBase, "/payments/service-health"));
        healthUris.put(Processor.FALLBACK, resolve(fallbackBase, "/payments/service-health"));

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    static URI resolve(URI base, String path) {
        String root = base.toString();
        if (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        return URI.create(root + path);
    }

    @Override
    public boolean submit(Processor processor, Payment payment) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(paymentUris.get(processor))
                .header(CONTENT_TYPE_HEADER, APPLICATION_JSON)
                .timeout(paymentTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(JsonUtils.toPaymentJsonBytes(payment)))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Processor {} answered {} for payment {}",
                        processor.jsonName(), response.statusCode(), payment.correlationId());
                return false;
            }
            return SUCCESS_MESSAGE.equals(JsonUtils.parseProcessorMessage(response.body()));
        } catch (IOException e) {
            log.debug("Processor {} call failed for payment {}: {}",
                    processor.jsonName(), payment.correlationId(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean checkHealth(Processor processor) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(healthUris.get(processor))
                .timeout(healthCheckTimeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return false;
            }
            ServiceHealthResponse health = JsonUtils.parseServiceHealth(response.body());
            return !health.failing();
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Health check of {} failed: {}", processor.jsonName(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
