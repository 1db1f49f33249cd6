package com.vmreconciler.core.export;

import com.vmreconciler.core.export.PhysicalSpec.KeyFile;
import com.vmreconciler.core.export.PhysicalSpec.PassphraseOverride;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.StateRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Hands generated encryption keys to the machine's own configuration, since
 * they cannot be derived from the declaration.
 */
@Component
public class PhysicalSpecExporter {

    static final int OVERRIDE_PRIORITY = 10;
    static final String KEY_FILE_PREFIX = "luks-";

    public PhysicalSpec export(StateRecord state) {
        var overrides = new LinkedHashMap<String, PassphraseOverride>();
        var keys = new LinkedHashMap<String, KeyFile>();

        for (DiskRecord disk : state.getDisks().values()) {
            var key = state.generatedKey(disk.id());
            if (!disk.needsGeneratedKey() || key == null) {
                continue;
            }
            overrides.put(disk.device(), new PassphraseOverride(key, OVERRIDE_PRIORITY));
            var fileName = KEY_FILE_PREFIX + (disk.name() != null ? disk.name() : disk.id());
            keys.put(fileName, new KeyFile(key, "root", "root", "0600"));
        }
        return new PhysicalSpec(overrides, keys);
    }
}
