package com.vmreconciler.cloud;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a VM resource. Updates are expressed by deriving a new value and
 * sending it back whole through {@link ComputeApi#createOrUpdate}.
 */
public record VirtualMachine(
    String name,
    String location,
    String size,
    String availabilitySet,
    ProvisioningState provisioningState,
    OsProfile osProfile,
    OsDisk osDisk,
    List<DataDisk> dataDisks,
    List<String> networkInterfaceIds
) {

    public VirtualMachine {
        dataDisks = dataDisks == null ? List.of() : List.copyOf(dataDisks);
        networkInterfaceIds = networkInterfaceIds == null ? List.of() : List.copyOf(networkInterfaceIds);
    }

    public Optional<DataDisk> findDataDisk(String uri) {
        return dataDisks.stream()
                .filter(d -> d.uri().equals(uri))
                .findFirst();
    }

    public VirtualMachine withDataDisks(List<DataDisk> newDataDisks) {
        return new VirtualMachine(name, location, size, availabilitySet, provisioningState,
                osProfile, osDisk, newDataDisks, networkInterfaceIds);
    }

    public VirtualMachine withDataDisk(DataDisk disk) {
        var disks = new ArrayList<>(dataDisks);
        disks.add(disk);
        return withDataDisks(disks);
    }

    public VirtualMachine withoutDataDisk(String uri) {
        return withDataDisks(dataDisks.stream()
                .filter(d -> !d.uri().equals(uri))
                .toList());
    }

    public VirtualMachine withSize(String newSize) {
        return new VirtualMachine(name, location, newSize, availabilitySet, provisioningState,
                osProfile, osDisk, dataDisks, networkInterfaceIds);
    }
}
