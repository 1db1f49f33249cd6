package com.vmreconciler.core.export;

import java.util.Map;

/**
 * Machine configuration fragments derived from the recorded state.
 *
 * @param passphraseOverrides forced passphrase per device path
 * @param keys secret files to upload, by file name
 */
public record PhysicalSpec(Map<String, PassphraseOverride> passphraseOverrides, Map<String, KeyFile> keys) {

    public PhysicalSpec {
        passphraseOverrides = Map.copyOf(passphraseOverrides);
        keys = Map.copyOf(keys);
    }

    /**
     * A configuration value that wins over the declared one; lower priority numbers win.
     */
    public record PassphraseOverride(String passphrase, int priority) {}

    public record KeyFile(String text, String user, String group, String permissions) {}
}
