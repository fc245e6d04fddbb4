package com.sweepwatch.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * CLI command: sweepwatch health
 * <p>
 * Shows the server's component health and the sweep health report with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand extends ServerCommand {

    public HealthCommand(SweepApiClient client) {
        super(client);
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        ConsoleOutput.printBanner();

        // 503 still carries the component breakdown
        var overall = client.get("/api/v1/health");
        boolean allUp = "UP".equals(overall.text("status"));
        Iterator<Map.Entry<String, JsonNode>> components = overall.body().path("components").fields();
        while (components.hasNext()) {
            var component = components.next();
            String status = component.getValue().path("status").asText();
            String label = component.getKey() + ": " + component.getValue().path("detail").asText();
            switch (status) {
                case "UP" -> ConsoleOutput.success(label);
                case "DOWN" -> ConsoleOutput.error(label);
                default -> ConsoleOutput.info(label);
            }
        }

        var sweep = client.get(SweepApiClient.SWEEP_PATH + "/health");
        if (sweep.ok()) {
            JsonNode body = sweep.body();
            System.out.println();
            print(body.path("hardwareDetected").asBoolean(), "Hardware: " + sweep.text("deviceInfo"));
            ConsoleOutput.info("Sweep process running: " + body.path("processRunning").asBoolean());
            ConsoleOutput.info("Stream clients: " + body.path("sseClientCount").asInt());
            JsonNode validation = body.path("stateValidation");
            print(validation.path("consistent").asBoolean(true),
                    "State validation: " + validation.path("detail").asText("-"));
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }

    private static void print(boolean good, String label) {
        if (good) {
            ConsoleOutput.success(label);
        } else {
            ConsoleOutput.error(label);
        }
    }
}
