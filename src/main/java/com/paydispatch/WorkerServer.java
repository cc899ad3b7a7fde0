package com.paydispatch;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.interactor.HealthTracker;
import com.paydispatch.interactor.PaymentProcessorClient;
import com.paydispatch.interactor.PaymentRouter;
import com.paydispatch.interactor.PaymentService;
import com.paydispatch.interactor.ProcessorHealth;
import com.paydispatch.interactor.SettlementService;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.transport.HttpPaymentProcessorClient;
import com.paydispatch.transport.PaymentSummaryHandler;
import com.paydispatch.transport.SettlementHandler;
import com.paydispatch.util.DaemonThreadFactory;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class WorkerServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerServer.class);

    private final HttpServer server;
    private final ExecutorService httpExecutor;
    private final ProcessorHealth health;
    private final HealthTracker healthTracker;
    private final SettlementService settlementService;

    public WorkerServer(DispatcherConfig config, PaymentRepository repository) throws IOException {
        this(config, repository, new HttpPaymentProcessorClient(
                config.defaultProcessorUrl(), config.fallbackProcessorUrl(),
                config.paymentTimeout(), config.healthCheckTimeout()));
    }

    public WorkerServer(DispatcherConfig config, PaymentRepository repository,
                        PaymentProcessorClient processorClient) throws IOException {
        this.health = new ProcessorHealth();
        this.healthTracker = new HealthTracker(processorClient, health, config.healthCheckInterval());
        var router = new PaymentRouter(repository, health, processorClient);
        this.settlementService = new SettlementService(router, config.settlementThreads(), config.settlementQueueSize());

        var settlementHandler = new SettlementHandler(settlementService);
        var summaryHandler = new PaymentSummaryHandler(new PaymentService(repository));

        this.server = HttpServer.create(new InetSocketAddress(config.httpPort()), GatewayServer.BACKLOG);
        server.createContext("/process-payment", settlementHandler::handleProcessPayment);
        server.createContext("/payments-summary", summaryHandler::handlePaymentsSummary);
        server.createContext("/purge-payments", summaryHandler::handlePurgePayments);
        server.createContext("/healthz", summaryHandler::handleHealthz);

        this.httpExecutor = Executors.newFixedThreadPool(GatewayServer.HTTP_THREADS,
                new DaemonThreadFactory("worker-http-"));
        server.setExecutor(httpExecutor);
    }

    public void start() {
        healthTracker.start();
        server.start();
        log.info("Worker listening on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    ProcessorHealth health() {
        return health;
    }

    @Override
    public void close() {
        server.stop(0);
        healthTracker.close();
        settlementService.close();
        httpExecutor.shutdownNow();
        log.info("Worker stopped");
    }
}
