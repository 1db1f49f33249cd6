package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.backup.BackupService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command group: vm-reconciler backup create|restore|remove|list
 */
@Command(name = "backup", mixinStandardHelpOptions = true,
        description = "Snapshot, restore and list disk backups",
        subcommands = {
                BackupCommand.Create.class,
                BackupCommand.Restore.class,
                BackupCommand.Remove.class,
                BackupCommand.ListBackups.class
        })
@Component
public class BackupCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Snapshot every disk of a machine")
    @Component
    public static class Create implements Callable<Integer> {

        private static final DateTimeFormatter BACKUP_ID_FORMAT =
                DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

        @Parameters(index = "0", description = "Machine declaration (JSON)")
        private Path specFile;

        @Option(names = "--id", description = "Backup id (default: current UTC timestamp)")
        private String backupId;

        private final MachineSession session;
        private final BackupService backupService;
        private final Clock clock;

        @Autowired
        public Create(MachineSession session, BackupService backupService) {
            this(session, backupService, Clock.systemUTC());
        }

        Create(MachineSession session, BackupService backupService, Clock clock) {
            this.session = session;
            this.backupService = backupService;
            this.clock = clock;
        }

        @Override
        public Integer call() {
            var id = backupId != null ? backupId : BACKUP_ID_FORMAT.format(clock.instant());
            return session.withSpec(specFile, "backup", (spec, state) -> {
                backupService.backup(spec, state, id);
                ConsoleOutput.success("Backup " + id + " of " + spec.machineName() + " recorded");
                return 0;
            });
        }
    }

    @Command(name = "restore", mixinStandardHelpOptions = true,
            description = "Overwrite disks with a backup and re-create the machine")
    @Component
    public static class Restore implements Callable<Integer> {

        @Parameters(index = "0", description = "Machine declaration (JSON)")
        private Path specFile;

        @Option(names = "--id", required = true, description = "Backup id")
        private String backupId;

        @Option(names = "--device", description = "Restore only this device (repeatable)")
        private List<String> devices = new ArrayList<>();

        private final MachineSession session;
        private final BackupService backupService;

        public Restore(MachineSession session, BackupService backupService) {
            this.session = session;
            this.backupService = backupService;
        }

        @Override
        public Integer call() {
            return session.withSpec(specFile, "restore", (spec, state) -> {
                backupService.restore(spec, state, backupId, devices);
                ConsoleOutput.success("Restored " + spec.machineName() + " from backup " + backupId);
                return 0;
            });
        }
    }

    @Command(name = "remove", mixinStandardHelpOptions = true, description = "Delete the snapshots of a backup")
    @Component
    public static class Remove implements Callable<Integer> {

        @Parameters(index = "0", description = "Machine name")
        private String machineName;

        @Option(names = "--id", required = true, description = "Backup id")
        private String backupId;

        private final MachineSession session;
        private final BackupService backupService;

        public Remove(MachineSession session, BackupService backupService) {
            this.session = session;
            this.backupService = backupService;
        }

        @Override
        public Integer call() {
            return session.withRecord(machineName, "backup-remove", state -> {
                backupService.removeBackup(state, backupId);
                ConsoleOutput.success("Backup " + backupId + " removed");
                return 0;
            });
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List backups and whether they are usable")
    @Component
    public static class ListBackups implements Callable<Integer> {

        @Parameters(index = "0", description = "Machine name")
        private String machineName;

        private final MachineSession session;
        private final BackupService backupService;

        public ListBackups(MachineSession session, BackupService backupService) {
            this.session = session;
            this.backupService = backupService;
        }

        @Override
        public Integer call() {
            return session.withRecord(machineName, "backup-list", state -> {
                var backups = backupService.listBackups(state);
                if (backups.isEmpty()) {
                    ConsoleOutput.info("No backups recorded for " + machineName);
                }
                backups.forEach(ConsoleOutput::backup);
                return 0;
            });
        }
    }
}
