package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.backup.BackupStatus;
import com.vmreconciler.core.drift.DriftWarning;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) VM-RECONCILER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void drift(DriftWarning warning) {
        String tag = warning.autoFixed() ? "@|fg(yellow) [DRIFT fixed]|@ " : "@|fg(red) [DRIFT]|@ ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(tag + warning.message()));
    }

    public static void backup(String backupId, BackupStatus status) {
        String color = switch (status.status()) {
            case COMPLETE -> "fg(green)";
            case INCOMPLETE -> "fg(yellow)";
            case UNAVAILABLE -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + backupId + "|@ @|" + color + " " + status.status() + "|@"));
        for (String line : status.info()) {
            System.out.println("    " + line);
        }
    }
}
