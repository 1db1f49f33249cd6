package com.vmreconciler.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setMachine puts machine and resourceGroup in MDC")
    void setMachine() {
        MdcContext.setMachine("web-1", "rg-prod");
        assertEquals("web-1", MDC.get("machine"));
        assertEquals("rg-prod", MDC.get("resourceGroup"));
    }

    @Test
    @DisplayName("setMachine without resource group leaves it unset")
    void setMachineWithoutGroup() {
        MdcContext.setMachine("web-1", null);
        assertEquals("web-1", MDC.get("machine"));
        assertNull(MDC.get("resourceGroup"));
    }

    @Test
    @DisplayName("clear removes all reconciler MDC keys")
    void clear() {
        MdcContext.setMachine("web-1", "rg-prod");
        MdcContext.setOperation("deploy");
        MdcContext.clear();
        assertNull(MDC.get("machine"));
        assertNull(MDC.get("resourceGroup"));
        assertNull(MDC.get("operation"));
    }
}
