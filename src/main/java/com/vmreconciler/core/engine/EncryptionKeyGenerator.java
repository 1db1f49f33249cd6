package com.vmreconciler.core.engine;

import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates LUKS passphrases for encrypted disks declared without one.
 * A key, once stored, is never regenerated.
 */
@Component
public class EncryptionKeyGenerator {

    private static final Logger log = LoggerFactory.getLogger(EncryptionKeyGenerator.class);

    static final int KEY_BYTES = 256;

    private final SecureRandom random = new SecureRandom();

    /**
     * @return number of keys generated
     */
    public int generateMissingKeys(StateRecord state) {
        int generated = 0;
        for (DiskRecord disk : state.getDisks().values()) {
            if (disk.needsGeneratedKey() && state.generatedKey(disk.id()) == null) {
                log.info("generating an encryption key for disk {}", disk.label());
                state.putGeneratedKey(disk.id(), newKey());
                generated++;
            }
        }
        return generated;
    }

    String newKey() {
        var bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }
}
