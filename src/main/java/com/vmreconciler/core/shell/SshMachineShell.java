package com.vmreconciler.core.shell;

import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link MachineShell} that shells out to the {@code ssh} CLI via {@link ProcessBuilder},
 * addressing the machine by its recorded public IPv4.
 */
@Component
public class SshMachineShell implements MachineShell {

    private static final Logger log = LoggerFactory.getLogger(SshMachineShell.class);

    private final ReconcilerProperties properties;

    public SshMachineShell(ReconcilerProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean run(StateRecord machine, String command) {
        var host = machine.getPublicIpv4();
        if (host == null) {
            log.warn("{} has no public IPv4 address; skipping '{}'", machine.fullName(), command);
            return false;
        }

        Process process = null;
        try {
            process = new ProcessBuilder(buildCommand(host, command))
                    .redirectErrorStream(true)
                    .start();

            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("{}: {}", host, line);
                }
            }

            if (!process.waitFor(properties.getSshTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("'{}' on {} did not finish within {}s", command, host, properties.getSshTimeoutSeconds());
                return false;
            }
            int exit = process.exitValue();
            if (exit != 0) {
                log.warn("'{}' on {} exited with status {}", command, host, exit);
            }
            return exit == 0;
        } catch (IOException e) {
            log.warn("Failed to run '{}' on {}: {}", command, host, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running '{}' on {}", command, host);
            return false;
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    List<String> buildCommand(String host, String command) {
        var argv = new ArrayList<String>();
        argv.add("ssh");
        argv.addAll(properties.getSshOptions());
        argv.add(properties.getSshUser() + "@" + host);
        argv.add(command);
        return argv;
    }
}
