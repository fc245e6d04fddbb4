package com.sweepwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * CLI command: sweepwatch reset
 */
@Command(name = "reset", mixinStandardHelpOptions = true,
        description = "Kill all sweep processes, clear recovery state and return to IDLE")
@Component
public class ResetCommand extends ServerCommand {

    public ResetCommand(SweepApiClient client) {
        super(client);
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        var response = client.post(SweepApiClient.SWEEP_PATH + "/reset", null);
        if (!response.ok()) {
            printFailure(response);
            return;
        }
        ConsoleOutput.success("Server reset: " + response.text("processesKilled") + " process(es) killed, "
                + response.text("clientsNotified") + " client(s) notified");
        ConsoleOutput.phase(response.text("finalState"));
    }
}
