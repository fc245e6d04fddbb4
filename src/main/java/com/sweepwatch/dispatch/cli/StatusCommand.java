package com.sweepwatch.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sweepwatch.dispatch.client.ClientProperties;
import com.sweepwatch.dispatch.client.ClientReconnector;
import com.sweepwatch.dispatch.client.ExecutorClientScheduler;
import com.sweepwatch.dispatch.client.HttpStreamConnector;
import com.sweepwatch.dispatch.client.ReconnectorState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: sweepwatch status [--watch]
 * <p>
 * Shows the current cycle status, or with {@code --watch} follows the live event stream,
 * reconnecting with backoff when the server goes away.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show sweep status")
@Component
public class StatusCommand extends ServerCommand {

    @Option(names = {"--watch", "-w"}, description = "Follow live updates via SSE")
    private boolean watch;

    @Option(names = {"--types", "-t"}, description = "Comma-separated event types to watch (default: all)")
    private String types;

    private final ClientProperties clientProperties;

    public StatusCommand(SweepApiClient client, ClientProperties clientProperties) {
        super(client);
        this.clientProperties = clientProperties;
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        if (watch) {
            runWatchMode();
            return;
        }

        var response = client.get(SweepApiClient.SWEEP_PATH + "/cycle-status");
        if (!response.ok()) {
            printFailure(response);
            return;
        }
        JsonNode status = response.body();
        ConsoleOutput.phase(response.text("phase"));

        JsonNode frequencies = status.path("frequencies");
        int current = status.path("currentIndex").asInt();
        if (!frequencies.isEmpty()) {
            System.out.println();
            System.out.printf("  %-4s %-12s %-10s %s%n", "#", "CENTER MHz", "SPAN MHz", "");
            System.out.println("  " + "-".repeat(40));
            int i = 0;
            for (JsonNode f : frequencies) {
                String marker = i == current ? "<- current" : "";
                if (isBlacklisted(status, i)) {
                    marker = "blacklisted";
                }
                System.out.printf("  %-4d %-12.3f %-10.1f %s%n", i,
                        f.path("centerMhz").asDouble(), f.path("spanMhz").asDouble(), marker);
                i++;
            }
            System.out.println();
            ConsoleOutput.info("Cycle time: " + ConsoleOutput.formatDuration(status.path("cycleTimeMs").asLong())
                    + ", next switch in " + ConsoleOutput.formatDuration(status.path("timeRemainingMs").asLong()));
        }

        JsonNode process = status.path("processHealth");
        if (process.path("running").asBoolean()) {
            ConsoleOutput.success("Process " + process.path("processId").asText() + " running");
        } else {
            ConsoleOutput.info("No sweep process running");
        }

        int errors = status.path("consecutiveErrorCount").asInt();
        if (errors > 0) {
            ConsoleOutput.error("Consecutive errors: " + errors + " (last: " + response.text("lastError") + ")");
        }
    }

    private static boolean isBlacklisted(JsonNode status, int index) {
        for (JsonNode b : status.path("blacklistedIndices")) {
            if (b.asInt() == index) {
                return true;
            }
        }
        return false;
    }

    private void runWatchMode() throws InterruptedException {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching " + client.baseUrl() + " (Ctrl+C to stop)...");
        System.out.println();

        CountDownLatch finished = new CountDownLatch(1);
        HttpStreamConnector connector = new HttpStreamConnector(client.dataStreamUri(types),
                Duration.ofMillis(clientProperties.getConnectTimeoutMs()));

        try (ExecutorClientScheduler scheduler = new ExecutorClientScheduler();
             ClientReconnector reconnector = new ClientReconnector(connector, scheduler, clientProperties,
                     new ClientReconnector.Listener() {
                         @Override
                         public void onEvent(String name, String data) {
                             ConsoleOutput.watchEvent(name, data);
                         }

                         @Override
                         public void onStateChange(ReconnectorState state) {
                             reportState(state);
                             if (state.terminal()) {
                                 finished.countDown();
                             }
                         }
                     })) {
            reconnector.start();
            finished.await();
        }
        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }

    private static void reportState(ReconnectorState state) {
        switch (state.connection()) {
            case CONNECTED -> ConsoleOutput.connection("connected");
            case RECONNECTING -> ConsoleOutput.connection(state.message());
            case TERMINAL -> ConsoleOutput.error(state.message());
            default -> {
                // connecting and closed are not reported
            }
        }
    }
}
