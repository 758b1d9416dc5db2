package com.acme.analytics.collector.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class CollectorServerMain {
    private static final Logger LOG = Logger.getLogger(CollectorServerMain.class.getName());
    private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";

    private CollectorServerMain() {}

    public static void main(String[] args) throws Exception {
        installLoggingConfig();

        CollectorConfig config = CollectorConfig.fromEnvironment(System.getenv());
        CollectorServer server = CollectorServer.create(config);

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runnable stopAndSignal = () -> {
            try {
                server.stop();
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "collector-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            server.start();
            LOG.info(() -> "Analytics collector listening on :" + server.ingestPort()
                + (server.metricsPort() >= 0 ? ", metrics on :" + server.metricsPort() : ""));
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // JVM is shutting down and hook is already in-flight.
            }
            stopAndSignal.run();
        }
    }

    static void installLoggingConfig() {
        if (System.getProperty(LOGGING_CONFIG_PROPERTY) != null) {
            return;
        }
        try (InputStream in = CollectorServerMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.warning("Failed to load bundled logging.properties: " + e.getMessage());
        }
    }
}
