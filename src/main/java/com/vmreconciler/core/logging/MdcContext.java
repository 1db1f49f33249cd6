package com.vmreconciler.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys identifying the machine an operation works on.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMachine(String machineName, String resourceGroup) {
        MDC.put("machine", machineName);
        if (resourceGroup != null) {
            MDC.put("resourceGroup", resourceGroup);
        }
    }

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("machine");
        MDC.remove("resourceGroup");
        MDC.remove("operation");
    }
}
