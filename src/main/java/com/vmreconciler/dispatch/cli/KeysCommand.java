package com.vmreconciler.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmreconciler.core.export.PhysicalSpecExporter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

/**
 * CLI command: vm-reconciler keys &lt;machine&gt;
 * <p>
 * Prints the passphrase overrides and key files the guest needs to open its
 * encrypted disks.
 */
@Command(name = "keys", mixinStandardHelpOptions = true,
        description = "Print the guest-side key configuration for encrypted disks")
@Component
public class KeysCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    private final MachineSession session;
    private final PhysicalSpecExporter exporter;
    private final ObjectMapper objectMapper;

    public KeysCommand(MachineSession session, PhysicalSpecExporter exporter, ObjectMapper objectMapper) {
        this.session = session;
        this.exporter = exporter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        return session.withRecord(machineName, "keys", state -> {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(exporter.export(state)));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
            return 0;
        });
    }
}
