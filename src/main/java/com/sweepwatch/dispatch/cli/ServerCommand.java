package com.sweepwatch.dispatch.cli;

import java.io.IOException;
import java.net.ConnectException;

/**
 * Base for commands that call a running sweepwatch server.
 */
abstract class ServerCommand implements Runnable {

    protected final SweepApiClient client;

    protected ServerCommand(SweepApiClient client) {
        this.client = client;
    }

    protected abstract void execute() throws IOException, InterruptedException;

    @Override
    public void run() {
        try {
            execute();
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to sweepwatch server at " + client.baseUrl());
            ConsoleOutput.info("Start the server first: sweepwatch serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
        }
    }

    protected static void printFailure(SweepApiClient.ApiResponse response) {
        String detail = response.body().hasNonNull("error")
                ? response.body().get("error").asText()
                : response.text("message");
        ConsoleOutput.error("Server returned HTTP " + response.status() + ": " + detail);
    }
}
