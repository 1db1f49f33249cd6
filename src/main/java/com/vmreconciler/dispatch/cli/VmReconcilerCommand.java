package com.vmreconciler.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Top-level CLI command.
 */
@Command(
        name = "vm-reconciler",
        mixinStandardHelpOptions = true,
        version = "vm-reconciler 0.1.0",
        description = "Reconciles declared Azure virtual machines and their disks",
        subcommands = {
                DeployCommand.class,
                CheckCommand.class,
                StartCommand.class,
                StopCommand.class,
                RebootCommand.class,
                DestroyCommand.class,
                BackupCommand.class,
                KeysCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VmReconcilerCommand implements Runnable {

    private final ConsoleConfirmer confirmer;

    public VmReconcilerCommand(ConsoleConfirmer confirmer) {
        this.confirmer = confirmer;
    }

    @Option(names = {"-y", "--yes"}, description = "Answer yes to every confirmation")
    void setAssumeYes(boolean assumeYes) {
        if (assumeYes) {
            confirmer.assumeYes();
        }
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
