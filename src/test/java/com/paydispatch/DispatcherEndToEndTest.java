package com.paydispatch;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.datasource.JdbcPaymentRepository;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.Processor;
import com.paydispatch.support.Await;
import com.paydispatch.support.StubProcessorServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Gateway and worker wired over HTTP to stub processors, sharing one H2 store.
 */
class DispatcherEndToEndTest {

    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private StubProcessorServer defaultProcessor;
    private StubProcessorServer fallbackProcessor;
    private JdbcPaymentRepository repository;
    private WorkerServer worker;
    private GatewayServer gateway;

    @BeforeEach
    void setUp() throws IOException {
        defaultProcessor = new StubProcessorServer();
        fallbackProcessor = new StubProcessorServer();
        repository = JdbcPaymentRepository.connect(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");

        Map<String, String> env = new HashMap<>();
        env.put("HTTP_PORT", "0");
        env.put("PAYMENT_PROCESSOR_URL_DEFAULT", defaultProcessor.baseUri().toString());
        env.put("PAYMENT_PROCESSOR_URL_FALLBACK", fallbackProcessor.baseUri().toString());
        env.put("HEALTH_CHECK_INTERVAL_MS", "100");
        env.put("HEALTH_CHECK_TIMEOUT_MS", "500");
        env.put("PAYMENT_TIMEOUT_MS", "1000");
        env.put("NUM_WORKERS", "4");

        env.put("MODE", "worker");
        worker = new WorkerServer(DispatcherConfig.fromEnvironment(env), repository);
        worker.start();

        env.put("MODE", "gateway");
        env.put("WORKER_URL", "http://127.0.0.1:" + worker.port());
        gateway = new GatewayServer(DispatcherConfig.fromEnvironment(env), repository);
        gateway.start();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
        worker.close();
        repository.close();
        defaultProcessor.close();
        fallbackProcessor.close();
    }

    private HttpResponse<String> submit(String correlationId, String amount) throws IOException, InterruptedException {
        return http.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + gateway.port() + "/payments"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(
                        "{\"correlationId\":\"" + correlationId + "\",\"amount\":" + amount + "}"))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private long settledCount() {
        PaymentSummary summary = repository.getPaymentsSummary(null, null);
        return summary.defaultProcessor().totalRequests() + summary.fallback().totalRequests();
    }

    @Test
    void acceptedPaymentsSettleOnDefault() throws Exception {
        for (int i = 0; i < 20; i++) {
            assertEquals(200, submit("e2e-" + i, "19.90").statusCode());
        }

        Await.until(Duration.ofSeconds(10), () -> settledCount() == 20, "20 payments settled");
        PaymentSummary summary = repository.getPaymentsSummary(null, null);
        assertEquals(20, summary.defaultProcessor().totalRequests());
        assertEquals(0, new BigDecimal("398.00").compareTo(summary.defaultProcessor().totalAmount()));
        assertEquals(20, defaultProcessor.receivedBodies().size());
        assertTrue(fallbackProcessor.receivedBodies().isEmpty());
    }

    @Test
    void duplicateSubmissionSettlesOnce() throws Exception {
        assertEquals(200, submit("dup", "10.00").statusCode());
        Await.until(Duration.ofSeconds(10), () -> settledCount() == 1, "first copy settled");

        assertEquals(200, submit("dup", "10.00").statusCode());
        assertEquals(200, submit("after-dup", "1.00").statusCode());
        Await.until(Duration.ofSeconds(10), () -> settledCount() == 2, "second payment settled");

        assertEquals(1, defaultProcessor.receivedBodies().stream().filter(b -> b.contains("\"dup\"")).count());
    }

    @Test
    void failingDefaultFailsOverToFallback() throws Exception {
        defaultProcessor.failing(true).paymentStatus(500);
        Await.until(Duration.ofSeconds(5), () -> !worker.health().isHealthy(Processor.DEFAULT),
                "default marked unhealthy");

        assertEquals(200, submit("fo-1", "5.00").statusCode());

        Await.until(Duration.ofSeconds(10), () -> settledCount() == 1, "payment settled");
        PaymentSummary summary = repository.getPaymentsSummary(null, null);
        assertEquals(0, summary.defaultProcessor().totalRequests());
        assertEquals(1, summary.fallback().totalRequests());
    }

    @Test
    void purgeThroughGatewayResetsSummary() throws Exception {
        submit("p-1", "10.00");
        Await.until(Duration.ofSeconds(10), () -> settledCount() == 1, "payment settled");

        HttpResponse<String> purge = http.send(HttpRequest.newBuilder(
                        URI.create("http://127.0.0.1:" + gateway.port() + "/purge-payments"))
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> summary = http.send(HttpRequest.newBuilder(
                        URI.create("http://127.0.0.1:" + gateway.port() + "/payments-summary")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, purge.statusCode());
        assertEquals("{\"default\":{\"totalRequests\":0,\"totalAmount\":0},"
                + "\"fallback\":{\"totalRequests\":0,\"totalAmount\":0}}", summary.body());
    }
}
