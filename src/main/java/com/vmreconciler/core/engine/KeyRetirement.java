package com.vmreconciler.core.engine;

import com.vmreconciler.core.model.StateRecord;
import org.springframework.stereotype.Component;

/**
 * Discards a generated encryption key, but only after the operator agrees.
 */
@Component
public class KeyRetirement {

    private final Confirmer confirmer;

    public KeyRetirement(Confirmer confirmer) {
        this.confirmer = confirmer;
    }

    /**
     * @return whether the key is gone afterwards
     */
    public boolean retire(StateRecord state, String diskId) {
        if (state.generatedKey(diskId) == null) {
            return true;
        }
        if (!confirmer.confirm(("Azure disk %s has an automatically generated encryption key; if the key is "
                + "deleted, the data will be lost even if you have a copy of the disk contents; are you sure "
                + "you want to delete the encryption key?").formatted(diskId))) {
            return false;
        }
        state.removeGeneratedKey(diskId);
        return true;
    }
}
