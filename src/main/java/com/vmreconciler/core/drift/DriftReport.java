package com.vmreconciler.core.drift;

import java.util.List;

public record DriftReport(List<DriftWarning> warnings) {

    public DriftReport {
        warnings = List.copyOf(warnings);
    }

    public static DriftReport clean() {
        return new DriftReport(List.of());
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }

    public boolean has(DriftKind kind) {
        return warnings.stream().anyMatch(w -> w.kind() == kind);
    }
}
