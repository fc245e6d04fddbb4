package com.sweepwatch.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * CLI command: sweepwatch sync
 * <p>
 * Asks the server to reconcile its believed sweep state with the processes actually running.
 */
@Command(name = "sync", mixinStandardHelpOptions = true, description = "Reconcile sweep state with running processes")
@Component
public class SyncCommand extends ServerCommand {

    public SyncCommand(SweepApiClient client) {
        super(client);
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        var response = client.post(SweepApiClient.SWEEP_PATH + "/sync", null);
        if (!response.ok()) {
            printFailure(response);
            return;
        }
        JsonNode changes = response.body().path("changes");
        if (changes.isEmpty()) {
            ConsoleOutput.success("State consistent: " + response.text("afterState"));
            return;
        }
        ConsoleOutput.info("State corrected: " + response.text("beforeState") + " -> " + response.text("afterState"));
        for (JsonNode change : changes) {
            System.out.println("  - " + change.asText());
        }
    }
}
