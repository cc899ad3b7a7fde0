package com.paydispatch;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.entity.Processor;
import com.paydispatch.support.Await;
import com.paydispatch.support.FakeProcessorClient;
import com.paydispatch.support.InMemoryPaymentRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerServerTest {

    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private InMemoryPaymentRepository repository;
    private FakeProcessorClient processors;
    private WorkerServer worker;

    @BeforeEach
    void setUp() throws IOException {
        repository = new InMemoryPaymentRepository();
        processors = new FakeProcessorClient();
        DispatcherConfig config = DispatcherConfig.fromEnvironment(Map.of(
                "MODE", "worker",
                "HTTP_PORT", "0",
                "HEALTH_CHECK_INTERVAL_MS", "50"));
        worker = new WorkerServer(config, repository, processors);
        worker.start();
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    private HttpResponse<String> process(String body) throws IOException, InterruptedException {
        return http.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + worker.port() + "/process-payment"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void acceptsAndSettlesWithDefault() throws Exception {
        assertEquals(200, process("{\"correlationId\":\"A\",\"amount\":10.00}").statusCode());

        Await.until(Duration.ofSeconds(5), () -> repository.paymentCount() == 1, "payment settled");
        assertEquals(Processor.DEFAULT, repository.findByCorrelationId("A").orElseThrow().processor());
    }

    @Test
    void malformedForwardIsRejected() throws Exception {
        assertEquals(400, process("not json").statusCode());
        assertEquals(0, repository.paymentCount());
    }

    @Test
    void failingDefaultRoutesToFallbackOnceProbed() throws Exception {
        processors.healthy(Processor.DEFAULT, false);
        Await.until(Duration.ofSeconds(5), () -> !worker.health().isHealthy(Processor.DEFAULT),
                "default marked unhealthy");

        assertEquals(200, process("{\"correlationId\":\"B\",\"amount\":5.00}").statusCode());

        Await.until(Duration.ofSeconds(5), () -> repository.paymentCount() == 1, "payment settled");
        assertEquals(Processor.FALLBACK, repository.findByCorrelationId("B").orElseThrow().processor());
        assertTrue(processors.submissions(Processor.DEFAULT).isEmpty());

        processors.healthy(Processor.DEFAULT, true);
        Await.until(Duration.ofSeconds(5), () -> worker.health().isHealthy(Processor.DEFAULT),
                "default healthy again");
    }
}
