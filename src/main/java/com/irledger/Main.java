package com.irledger;

import com.irledger.adapter.in.web.HttpServerVerticle;
import com.irledger.infrastructure.config.AppConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Investor Ledger...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        JsonObject config = AppConfig.loadYaml(AppConfig.DEFAULT_RESOURCE);
        int port = new AppConfig(config).httpPort();

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Investor Ledger...");
                        vertx.close();
                    }));

                    log.info("Investor Ledger is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/investors", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
