package com.hallsync;

import com.hallsync.config.RelayConfig;
import com.hallsync.server.SyncServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the Hall Sync relay.
 *
 * Configuration comes from the JSON file named by the {@code hallsync.config}
 * system property, if set; a first command line argument overrides the port.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        RelayConfig config;
        try {
            config = loadConfig(args);
        } catch (Exception e) {
            logger.error("Invalid configuration", e);
            System.exit(1);
            return;
        }

        logger.info("===========================================");
        logger.info("  Hall Sync Relay");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");
        logger.debug("Effective configuration: {}", config);

        SyncServer server = new SyncServer(config);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }

    static RelayConfig loadConfig(String[] args) throws IOException {
        String configFile = System.getProperty(RelayConfig.CONFIG_PROPERTY);
        RelayConfig config = new RelayConfig();
        if (configFile != null && !configFile.isBlank()) {
            Path path = Paths.get(configFile);
            logger.info("Loading configuration from {}", path.toAbsolutePath());
            config = RelayConfig.load(path);
        }

        // Allow port override via command line argument
        if (args.length > 0) {
            try {
                config = config.toBuilder().port(Integer.parseInt(args[0])).build();
            } catch (NumberFormatException e) {
                logger.warn("Invalid port argument '{}', using port {}", args[0], config.getPort());
            }
        }
        return config.validate();
    }
}
