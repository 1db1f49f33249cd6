package com.vmreconciler.core.shell;

import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.model.StateRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SshMachineShellTest {

    @Test
    void buildsSshInvocationWithConfiguredOptions() {
        var properties = new ReconcilerProperties();
        properties.getSsh().setUser("admin");
        properties.getSsh().setOptions(List.of("-o", "BatchMode=yes"));
        var shell = new SshMachineShell(properties);

        assertEquals(List.of("ssh", "-o", "BatchMode=yes", "admin@203.0.113.4", "sg_scan /dev/sd*"),
                shell.buildCommand("203.0.113.4", "sg_scan /dev/sd*"));
    }

    @Test
    void machineWithoutAddressIsNotContacted() {
        var shell = new SshMachineShell(new ReconcilerProperties());

        assertFalse(shell.run(new StateRecord("web-1"), "umount -l /dev/disk/by-lun/0"));
    }
}
