package com.sweepwatch.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the sweepwatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWEEPWATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWEEPWATCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void phase(String phase) {
        String color = switch (phase) {
            case "RUNNING" -> "green";
            case "ERROR", "EMERGENCY_STOPPED" -> "red";
            case "STARTING", "STOPPING" -> "yellow";
            default -> "white";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Phase: @|bold,fg(" + color + ") " + phase + "|@"));
    }

    public static void connection(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [STREAM]|@ " + message));
    }

    /**
     * Prints one stream event in watch mode.
     */
    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "connected", "server_reset" -> "@|fg(magenta) [STREAM]|@";
            case "sweep_data" -> "@|fg(blue) [DATA]|@";
            case "status", "state_sync" -> "@|fg(cyan) [STATUS]|@";
            case "cycle_config" -> "@|bold,fg(yellow) [CYCLE]|@";
            case "recovery_start" -> "@|fg(yellow),bold [RECOVERY]|@";
            case "recovery_complete" -> "@|fg(green),bold [RECOVERED]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            case "heartbeat" -> "@|faint [HEARTBEAT]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
