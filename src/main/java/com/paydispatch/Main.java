package com.paydispatch;

import com.paydispatch.config.DispatcherConfig;
import com.paydispatch.datasource.PaymentRepositories;
import com.paydispatch.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static {
        System.setProperty("sun.net.httpserver.nodelay", "true");
        System.setProperty("sun.net.httpserver.maxConnections", "2000");
        System.setProperty("java.net.preferIPv4Stack", "true");
        System.setProperty("java.awt.headless", "true");
        System.setProperty("jdk.httpclient.connectionPoolSize", "100");
        System.setProperty("jdk.httpclient.keepalive.timeout", "10");
    }

    public static void main(String[] args) throws IOException {
        long startTime = System.nanoTime();

        DispatcherConfig config = DispatcherConfig.fromEnvironment();
        log.info("Payment dispatcher starting in {} mode", config.mode().name().toLowerCase(Locale.ROOT));

        PaymentRepository repository = PaymentRepositories.create(config);
        try {
            repository.verifyConnectivity();
        } catch (RuntimeException e) {
            repository.close();
            throw e;
        }

        AutoCloseable server = switch (config.mode()) {
            case GATEWAY -> {
                var gateway = new GatewayServer(config, repository);
                gateway.start();
                yield gateway;
            }
            case WORKER -> {
                var worker = new WorkerServer(config, repository);
                worker.start();
                yield worker;
            }
        };

        double startupTimeMillis = (System.nanoTime() - startTime) / 1_000_000.0;
        log.info("Started in {} ms", String.format("%.3f", startupTimeMillis));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                log.warn("Error while stopping the server", e);
            } finally {
                repository.close();
            }
        }, "shutdown"));
    }
}
