package com.vmreconciler.core.persistence;

import com.vmreconciler.core.model.StateRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of {@link StateRecord}s, one per machine name.
 */
public interface StateStore {

    Optional<StateRecord> load(String machineName);

    void save(StateRecord record);

    void delete(String machineName);

    List<String> machineNames();
}
