package io.envkeeper.server;

import io.envkeeper.core.SessionKind;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.driver.ShellProcessDriver;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a standalone supervisor process.
 * <p>
 * Responsibilities:
 *  - Apply the bundled logging.properties unless one was given on the command line.
 *  - Parse configuration from CLI flags (and the optional JSON file).
 *  - Register the built-in drivers. Browser and notebook drivers are embedded
 *    by the hosting agent through the Java API.
 *  - Open the Supervisor (reconciling sessions from the data dir) and serve HTTP.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = SupervisorConfig.fromArgs(args);
        Logger log = Logger.getLogger(Main.class.getName());

        var drivers = new DriverRegistry()
                .register(SessionKind.OTHER, new ShellProcessDriver());

        // no in-process agent: global run state arrives in POST /sessions/global/snapshots bodies
        var supervisor = new Supervisor(cfg, drivers, null).open();
        var web = new WebServer(cfg.httpPort(), supervisor);
        web.start();

        log.info(() -> "envkeeper listening on http://localhost:" + web.port() + " (data: " + cfg.dataDir() + ")");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                supervisor.close();
            }
        }, "shutdown"));
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(Main.class.getName()).log(Level.WARNING, "could not load logging.properties", e);
        }
    }
}
