package com.tracegate.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Arrays;

/**
 * CLI command: tracegate serve
 * <p>
 * Runs the REST API under {@code /api/v1} plus the actuator endpoints. When "serve" appears in
 * the arguments the launcher starts a servlet context and {@link CliRunner} leaves the command
 * line alone, so this class only contributes the ready banner and the help entry.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 tracegate serve}
 */
@Command(name = ServeCommand.NAME, mixinStandardHelpOptions = true,
        description = "Start the Tracegate HTTP server")
@Component
public class ServeCommand implements Runnable {

    public static final String NAME = "serve";

    @Value("${server.port:8080}")
    private int port;

    /** True when the arguments ask for server mode. */
    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains(NAME);
    }

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        String base = "http://localhost:" + port;
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tracegate server running on port " + port);
        System.out.println();
        System.out.println("  Plans:      " + base + "/api/v1/plans/{planId}");
        System.out.println("  Artifacts:  " + base + "/api/v1/artifacts");
        System.out.println("  Health:     " + base + "/api/v1/health");
        System.out.println("  Metrics:    " + base + "/actuator/prometheus");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
