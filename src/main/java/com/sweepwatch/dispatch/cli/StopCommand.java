package com.sweepwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

/**
 * CLI command: sweepwatch stop [--emergency | --cleanup]
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop the sweep")
@Component
public class StopCommand extends ServerCommand {

    static class Mode {
        @Option(names = {"--emergency", "-e"}, description = "Kill every sweep process immediately")
        boolean emergency;

        @Option(names = {"--cleanup"}, description = "Kill sweep and probe processes regardless of state")
        boolean cleanup;
    }

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private Mode mode;

    public StopCommand(SweepApiClient client) {
        super(client);
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        if (mode != null && mode.emergency) {
            var response = client.post(SweepApiClient.SWEEP_PATH + "/emergency-stop", null);
            if (!response.ok()) {
                printFailure(response);
                return;
            }
            int remaining = response.body().path("remainingProcesses").asInt();
            if (remaining == 0) {
                ConsoleOutput.success("Emergency stop complete, no sweep processes remain");
            } else {
                ConsoleOutput.error("Emergency stop left " + remaining + " process(es) running");
            }
            ConsoleOutput.phase(response.text("finalState"));
            return;
        }
        if (mode != null && mode.cleanup) {
            var response = client.post(SweepApiClient.SWEEP_PATH + "/force-cleanup", null);
            if (!response.ok()) {
                printFailure(response);
                return;
            }
            if (response.body().path("ok").asBoolean()) {
                ConsoleOutput.success("Cleanup killed " + response.text("killed") + " process(es)");
            } else {
                ConsoleOutput.error("Cleanup left " + response.text("remaining") + " process(es) running");
            }
            return;
        }

        var response = client.post(SweepApiClient.SWEEP_PATH + "/stop", null);
        if (response.ok() && response.body().path("stopped").asBoolean()) {
            ConsoleOutput.success(response.text("message"));
            ConsoleOutput.phase(response.text("finalState"));
        } else {
            printFailure(response);
        }
    }
}
