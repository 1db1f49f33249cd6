package com.vmreconciler.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmreconciler.SimulatedEnvironment;
import com.vmreconciler.core.export.PhysicalSpecExporter;
import com.vmreconciler.core.persistence.JsonFileStateStore;
import com.vmreconciler.core.spec.DesiredSpecParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.vmreconciler.SimulatedEnvironment.MACHINE;
import static com.vmreconciler.SimulatedEnvironment.RG;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the CLI through picocli without a Spring context, against a simulated
 * cloud and a state directory under {@code @TempDir}.
 */
class CliTest {

    private static final String DECLARATION = """
            {
              "machineName": "web-1",
              "size": "Standard_A1",
              "location": "westeurope",
              "storage": "acct",
              "virtualNetwork": "vnet",
              "resourceGroup": "rg-test",
              "rootDiskImageUrl": "https://acct.blob.core.windows.net/images/nixos.vhd",
              "obtainIp": true,
              "blockDeviceMapping": {
                "/dev/sda": {"name": "root", "mediaLink": "https://acct.blob.core.windows.net/vhds/root.vhd"},
                "/dev/disk/by-lun/0": {"name": "data", "mediaLink": "https://acct.blob.core.windows.net/vhds/data.vhd",
                                       "size": 10}
              }
            }
            """;

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimulatedEnvironment env;
    private JsonFileStateStore store;
    private Path specFile;

    @BeforeEach
    void setUp() throws IOException {
        env = new SimulatedEnvironment();
        store = new JsonFileStateStore(dir.resolve("state"), objectMapper);
        specFile = dir.resolve("web-1.json");
        Files.writeString(specFile, DECLARATION);
    }

    private CommandLine.IFactory createFactory() {
        var session = new MachineSession(store, new DesiredSpecParser(objectMapper));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DeployCommand.class) {
                    return (K) new DeployCommand(session, env.sequencer, env.teardown);
                }
                if (cls == CheckCommand.class) {
                    return (K) new CheckCommand(session, env.healthChecker);
                }
                if (cls == StartCommand.class) {
                    return (K) new StartCommand(session, env.lifecycle);
                }
                if (cls == StopCommand.class) {
                    return (K) new StopCommand(session, env.lifecycle);
                }
                if (cls == RebootCommand.class) {
                    return (K) new RebootCommand(session, env.lifecycle);
                }
                if (cls == DestroyCommand.class) {
                    return (K) new DestroyCommand(session, env.lifecycle);
                }
                if (cls == KeysCommand.class) {
                    return (K) new KeysCommand(session, new PhysicalSpecExporter(), objectMapper);
                }
                if (cls == BackupCommand.Create.class) {
                    return (K) new BackupCommand.Create(session, env.backups);
                }
                if (cls == BackupCommand.Restore.class) {
                    return (K) new BackupCommand.Restore(session, env.backups);
                }
                if (cls == BackupCommand.Remove.class) {
                    return (K) new BackupCommand.Remove(session, env.backups);
                }
                if (cls == BackupCommand.ListBackups.class) {
                    return (K) new BackupCommand.ListBackups(session, env.backups);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var confirmer = new ConsoleConfirmer(new ByteArrayInputStream(new byte[0]), capturePrintStream, false);
            var commandLine = new CommandLine(new VmReconcilerCommand(confirmer), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String name : new String[]{"deploy", "check", "start", "stop", "reboot", "destroy", "backup", "keys"}) {
                assertTrue(output.contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("vm-reconciler 0.1.0"));
        }

        @Test
        @DisplayName("deploy --help shows the guard options")
        void deployHelpOutput() {
            CliResult result = execute("deploy", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--allow-reboot"));
            assertTrue(result.output().contains("--allow-recreate"));
        }

        @Test
        @DisplayName("backup --help lists its subcommands")
        void backupHelpOutput() {
            CliResult result = execute("backup", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("restore"));
            assertTrue(result.output().contains("list"));
        }
    }

    @Nested
    @DisplayName("deploy")
    class Deploy {

        @Test
        @DisplayName("creates the machine and records its state")
        void createsMachine() {
            CliResult result = execute("deploy", specFile.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(env.cloud.get(RG, MACHINE).isPresent());
            var state = store.load(MACHINE).orElseThrow();
            assertTrue(state.isDeployed());
            assertEquals(2, state.getDisks().size());
        }

        @Test
        @DisplayName("an unreadable declaration fails without touching the cloud")
        void malformedDeclaration() throws IOException {
            Files.writeString(specFile, "{ not json");

            CliResult result = execute("deploy", specFile.toString());

            assertEquals(MachineSession.EXIT_FAILURE, result.exitCode());
            assertTrue(env.cloud.get(RG, MACHINE).isEmpty());
            assertTrue(store.load(MACHINE).isEmpty());
        }

        @Test
        @DisplayName("a rejected change still saves the record")
        void rejectedChange() throws IOException {
            assertEquals(0, execute("deploy", specFile.toString()).exitCode());
            Files.writeString(specFile, DECLARATION.replace("westeurope", "northeurope"));

            CliResult result = execute("deploy", specFile.toString());

            assertEquals(MachineSession.EXIT_FAILURE, result.exitCode());
            assertTrue(result.output().contains("location"));
            assertEquals("westeurope", store.load(MACHINE).orElseThrow().getLocation());
        }
    }

    @Nested
    @DisplayName("machine commands")
    class MachineCommands {

        @Test
        @DisplayName("commands on an unknown machine fail")
        void unknownMachine() {
            CliResult result = execute("check", "db-1");

            assertEquals(MachineSession.EXIT_FAILURE, result.exitCode());
            assertTrue(result.output().contains("No state recorded for machine db-1"));
        }

        @Test
        @DisplayName("check succeeds on a freshly deployed machine")
        void checkDeployed() {
            execute("deploy", specFile.toString());

            assertEquals(0, execute("check", MACHINE).exitCode());
        }

        @Test
        @DisplayName("check fails once the machine is gone")
        void checkMissing() {
            execute("deploy", specFile.toString());
            env.cloud.delete(RG, MACHINE);

            CliResult result = execute("check", MACHINE);

            assertEquals(MachineSession.EXIT_FAILURE, result.exitCode());
            assertTrue(result.output().contains("missing"));
        }

        @Test
        @DisplayName("destroy removes the machine and its record")
        void destroy() {
            execute("deploy", specFile.toString());

            CliResult result = execute("destroy", MACHINE);

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(env.cloud.get(RG, MACHINE).isEmpty());
            assertTrue(store.load(MACHINE).isEmpty());
        }

        @Test
        @DisplayName("a declined destroy keeps the record")
        void declinedDestroy() {
            execute("deploy", specFile.toString());
            env.answer = false;

            CliResult result = execute("destroy", MACHINE);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("kept"));
            assertTrue(store.load(MACHINE).isPresent());
        }

        @Test
        @DisplayName("keys prints the exported declaration as JSON")
        void keys() {
            execute("deploy", specFile.toString());

            CliResult result = execute("keys", MACHINE);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("{"));
        }
    }
}
