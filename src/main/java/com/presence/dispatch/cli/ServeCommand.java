package com.presence.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: presence serve
 * <p>
 * Runs the decision layer behind HTTP for a chat front end:
 * <ul>
 *   <li>POST /api/v1/turns: evaluate a message, optionally generate and complete it</li>
 *   <li>POST /api/v1/turns/complete: mastery voice, pattern tracking and memory write for generated text</li>
 *   <li>GET /api/v1/profiles/{userId}: longitudinal profile with insights</li>
 *   <li>GET /api/v1/stages and GET /api/v1/health</li>
 * </ul>
 * {@link com.presence.PresenceApplication#main} switches the servlet container on when "serve" is
 * among the arguments; the endpoint list is printed once the port is bound.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Presence HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printEndpoints(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printEndpoints(event.getWebServer().getPort());
    }

    static void printEndpoints(int port) {
        String base = "http://localhost:" + port + "/api/v1";
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Presence server running on port " + port);
        System.out.println();
        System.out.println("  Evaluate:  POST " + base + "/turns");
        System.out.println("  Complete:  POST " + base + "/turns/complete");
        System.out.println("  Profile:   GET  " + base + "/profiles/{userId}");
        System.out.println("  Stages:    GET  " + base + "/stages");
        System.out.println("  Health:    GET  " + base + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
