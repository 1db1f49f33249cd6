package com.vmreconciler.core.backup;

import com.vmreconciler.cloud.BlobApi;
import com.vmreconciler.cloud.BlobUrl;
import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.ResourceNotFoundException;
import com.vmreconciler.core.backup.BackupStatus.Availability;
import com.vmreconciler.core.engine.BackingStoreService;
import com.vmreconciler.core.engine.LifecycleDriver;
import com.vmreconciler.core.engine.VmProvisioner;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskMap;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disk backups as blob snapshots, recorded per backup id as
 * {@code mediaLink -> snapshotId}.
 */
@Service
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    static final String BACKUP_ID_METADATA = "backup_id";

    private final BlobApi blobApi;
    private final ComputeApi computeApi;
    private final BackingStoreService backingStore;
    private final LifecycleDriver lifecycle;
    private final VmProvisioner provisioner;
    private final ReconcilerMetrics metrics;

    public BackupService(BlobApi blobApi, ComputeApi computeApi, BackingStoreService backingStore,
                         LifecycleDriver lifecycle, VmProvisioner provisioner, ReconcilerMetrics metrics) {
        this.blobApi = blobApi;
        this.computeApi = computeApi;
        this.backingStore = backingStore;
        this.lifecycle = lifecycle;
        this.provisioner = provisioner;
        this.metrics = metrics;
    }

    public void backup(DesiredSpec spec, StateRecord state, String backupId) {
        log.info("backing up {} using ID '{}'", state.fullName(), backupId);

        if (!spec.disks().ids().equals(state.getDisks().ids())) {
            log.warn("the list of disks currently deployed doesn't match the current declaration; "
                    + "consider running 'deploy' first; the backup may be incomplete");
        }

        var snapshots = new LinkedHashMap<String, String>();
        for (DiskRecord disk : state.getDisks().values()) {
            log.info("snapshotting the BLOB {} backing the Azure disk {}", disk.id(), disk.name());
            var blob = backingStore.resolve(state, disk.id());
            var snapshotId = blobApi.snapshotBlob(blob, Map.of(
                    BACKUP_ID_METADATA, backupId,
                    "description", "backup of disk %s attached to %s".formatted(disk.name(), state.getMachineName())));
            metrics.recordRemoteCall("blob.snapshot");
            snapshots.put(disk.id(), snapshotId);
            state.putBackup(backupId, snapshots);
        }
    }

    /**
     * Stops and deprovisions the VM, copies the selected disks back from their
     * snapshots and provisions the VM again with the recorded configuration.
     *
     * @param devices media links, disk names or device paths to restore; empty for all
     */
    public void restore(DesiredSpec spec, StateRecord state, String backupId, List<String> devices) {
        var snapshots = state.getBackups().get(backupId);
        if (snapshots == null) {
            throw ReconcileException.configuration("backup %s not found".formatted(backupId));
        }
        log.info("restoring {} to backup '{}'", state.fullName(), backupId);

        if (state.hasVm()) {
            lifecycle.stop(state);
            log.info("temporarily deprovisioning {}", state.fullName());
            computeApi.delete(state.getResourceGroup(), state.getMachineName());
            metrics.recordRemoteCall("vm.delete");
            state.markResourceDeleted();
        }

        for (DiskRecord disk : state.getDisks().values()) {
            var snapshotId = snapshots.get(disk.id());
            if (snapshotId == null || !isSelected(disk, devices)) {
                continue;
            }
            var parsed = BlobUrl.parse(disk.id());
            if (parsed.isEmpty()) {
                log.warn("failed to parse BLOB URL {}; skipping", disk.id());
                continue;
            }
            var blob = backingStore.resolve(state, disk.id());
            if (blobApi.getProperties(blob.withSnapshot(snapshotId)).isEmpty()) {
                log.warn("snapshot {} for disk {} is missing; skipping", snapshotId, disk.id());
                continue;
            }
            log.info("restoring BLOB {} from snapshot {}", disk.id(), snapshotId);
            blobApi.copyBlob(blob, BlobUrl.snapshotUrl(disk.id(), snapshotId));
            metrics.recordRemoteCall("blob.copy");
        }

        provisioner.provision(recordedConfiguration(spec, state), state);
    }

    public void removeBackup(StateRecord state, String backupId) {
        log.info("removing backup {}", backupId);
        var snapshots = state.getBackups().get(backupId);
        if (snapshots == null) {
            log.warn("backup {} not found; skipping", backupId);
            return;
        }
        for (var entry : snapshots.entrySet()) {
            var blobUrl = entry.getKey();
            var snapshotId = entry.getValue();
            log.info("removing snapshot {} of BLOB {}", snapshotId, blobUrl);
            if (BlobUrl.parse(blobUrl).isEmpty()) {
                log.warn("failed to parse BLOB URL {}; skipping", blobUrl);
                continue;
            }
            try {
                blobApi.deleteBlob(backingStore.resolve(state, blobUrl).withSnapshot(snapshotId));
                metrics.recordRemoteCall("blob.delete");
            } catch (ResourceNotFoundException e) {
                log.warn("snapshot {} of BLOB {} does not exist; skipping", snapshotId, blobUrl);
            }
        }
        state.removeBackup(backupId);
    }

    public Map<String, BackupStatus> listBackups(StateRecord state) {
        var result = new LinkedHashMap<String, BackupStatus>();
        for (var backup : state.getBackups().entrySet()) {
            var snapshots = backup.getValue();
            var status = Availability.COMPLETE;
            var info = new ArrayList<String>();
            var processed = new HashSet<String>();

            for (DiskRecord disk : state.getDisks().values()) {
                var snapshotId = snapshots.get(disk.id());
                if (snapshotId == null) {
                    status = status.worst(Availability.INCOMPLETE);
                    info.add("%s - %s - not available in backup".formatted(state.getMachineName(), disk.id()));
                    continue;
                }
                processed.add(disk.id());
                var blob = BlobUrl.parse(disk.id());
                if (blob.isEmpty()) {
                    status = status.worst(Availability.UNAVAILABLE);
                    info.add("failed to parse BLOB URL " + disk.id());
                } else if (!blob.get().account().equals(state.getStorage())) {
                    status = status.worst(Availability.UNAVAILABLE);
                    info.add("storage %s declared for the machine doesn't match the storage of BLOB %s"
                            .formatted(state.getStorage(), disk.id()));
                } else if (blobApi.getProperties(blob.get().withSnapshot(snapshotId)).isEmpty()) {
                    status = status.worst(Availability.UNAVAILABLE);
                    info.add("%s - %s - %s - snapshot has disappeared"
                            .formatted(state.getMachineName(), disk.id(), snapshotId));
                }
            }

            for (var entry : snapshots.entrySet()) {
                if (!processed.contains(entry.getKey())) {
                    info.add("%s - %s - %s - a snapshot of a disk that is not or no longer deployed"
                            .formatted(state.getMachineName(), entry.getKey(), entry.getValue()));
                }
            }
            result.put(backup.getKey(), new BackupStatus(status, info));
        }
        return result;
    }

    private static boolean isSelected(DiskRecord disk, List<String> devices) {
        return devices.isEmpty()
                || devices.contains(disk.id())
                || devices.contains(disk.name())
                || devices.contains(disk.device());
    }

    /**
     * The configuration the machine had before it was deprovisioned, with every
     * recorded disk to be attached on creation.
     */
    private static DesiredSpec recordedConfiguration(DesiredSpec spec, StateRecord state) {
        var disks = DiskMap.of(state.getDisks().values().stream()
                .map(d -> d.withNeedsAttach(false))
                .toList());
        var size = state.getSize() != null ? state.getSize() : spec.size();
        return spec.withDisks(disks).withHardware(size, state.getAvailabilitySet());
    }
}
