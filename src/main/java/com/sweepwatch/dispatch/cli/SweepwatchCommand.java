package com.sweepwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for sweepwatch.
 * Routes to subcommands: serve, start, stop, status, sync, reset, health.
 */
@Command(
        name = "sweepwatch",
        mixinStandardHelpOptions = true,
        version = "sweepwatch 0.1.0",
        description = "Supervises HackRF frequency sweeps and streams spectrum data",
        subcommands = {
                ServeCommand.class,
                StartCommand.class,
                StopCommand.class,
                StatusCommand.class,
                SyncCommand.class,
                ResetCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SweepwatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
