package com.sweepwatch.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: sweepwatch serve
 * <p>
 * Starts the sweep supervisor as a long-running HTTP server exposing the control API and
 * the SSE data stream. The web server is enabled by
 * {@link com.sweepwatch.SweepwatchApplication#main} detecting "serve" in args; the banner is
 * printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 sweepwatch serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the sweep supervisor HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8092}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sweep supervisor running on port " + port);
        System.out.println();
        System.out.println("  API:          http://localhost:" + port + "/api/v1/sweep");
        System.out.println("  Data stream:  http://localhost:" + port + "/api/v1/sweep/data-stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
