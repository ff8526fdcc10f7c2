package com.presence.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Presence CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PRESENCE ENGINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PRESENCE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /** Crisis level with its traffic-light color. */
    public static void crisis(String level, String strategy) {
        String color = switch (level) {
            case "red" -> "fg(red),bold";
            case "yellow" -> "fg(yellow),bold";
            default -> "fg(green)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [CRISIS " + level.toUpperCase() + "]|@ strategy: " + strategy));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + label + ":|@ " + value));
    }

    public static void bullet(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(blue) -|@ " + message));
    }
}
