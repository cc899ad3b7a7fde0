package com.paydispatch;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.interactor.ComplianceLog;
import com.paydispatch.interactor.DispatchWorkerPool;
import com.paydispatch.interactor.PaymentAdmission;
import com.paydispatch.interactor.PaymentForwarder;
import com.paydispatch.interactor.PaymentQueue;
import com.paydispatch.interactor.PaymentService;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.transport.HttpPaymentForwarder;
import com.paydispatch.transport.PaymentHandler;
import com.paydispatch.transport.PaymentSummaryHandler;
import com.paydispatch.util.DaemonThreadFactory;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class GatewayServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    static final int BACKLOG = 4096;
    static final int HTTP_THREADS = 128;

    private final HttpServer server;
    private final ExecutorService httpExecutor;
    private final PaymentQueue queue;
    private final DispatchWorkerPool dispatchWorkers;
    private final ComplianceLog complianceLog;

    public GatewayServer(DispatcherConfig config, PaymentRepository repository) throws IOException {
        this(config, repository, new HttpPaymentForwarder(config.workerUrl(), config.forwardTimeout()));
    }

    public GatewayServer(DispatcherConfig config, PaymentRepository repository,
                         PaymentForwarder forwarder) throws IOException {
        this.queue = new PaymentQueue(config.queueSize());
        this.dispatchWorkers = new DispatchWorkerPool(queue, forwarder, config.dispatchWorkers());
        this.complianceLog = config.complianceLogEnabled() ? new ComplianceLog(repository) : null;

        var paymentHandler = new PaymentHandler(new PaymentAdmission(queue, complianceLog));
        var summaryHandler = new PaymentSummaryHandler(new PaymentService(repository));

        this.server = HttpServer.create(new InetSocketAddress(config.httpPort()), BACKLOG);
        server.createContext("/payments", paymentHandler::handlePayments);
        server.createContext("/payments-summary", summaryHandler::handlePaymentsSummary);
        server.createContext("/purge-payments", summaryHandler::handlePurgePayments);
        server.createContext("/healthz", summaryHandler::handleHealthz);

        this.httpExecutor = Executors.newFixedThreadPool(HTTP_THREADS, new DaemonThreadFactory("gateway-http-"));
        server.setExecutor(httpExecutor);
    }

    public void start() {
        if (complianceLog != null) {
            complianceLog.start();
        }
        dispatchWorkers.start();
        server.start();
        log.info("Gateway listening on port {} (queue capacity {})", port(), queue.capacity());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    PaymentQueue queue() {
        return queue;
    }

    @Override
    public void close() {
        server.stop(0);
        dispatchWorkers.close();
        if (complianceLog != null) {
            complianceLog.close();
        }
        httpExecutor.shutdownNow();
        log.info("Gateway stopped");
    }
}
