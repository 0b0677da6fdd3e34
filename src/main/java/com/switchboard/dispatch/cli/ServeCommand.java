package com.switchboard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard serve
 * <p>
 * Starts the OpenAI-compatible HTTP gateway. The web server is enabled by
 * {@link com.switchboard.SwitchboardApplication#main} detecting "serve" in
 * args, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the embedded server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 switchboard serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Switchboard HTTP gateway")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Switchboard gateway running on port " + port);
        System.out.println();
        System.out.println("  Chat:     POST http://localhost:" + port + "/v1/chat/completions");
        System.out.println("  Models:   GET  http://localhost:" + port + "/v1/models");
        System.out.println("  Metrics:  GET  http://localhost:" + port + "/v1/router/metrics");
        System.out.println("  Health:   GET  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
