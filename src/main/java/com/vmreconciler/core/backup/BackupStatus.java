package com.vmreconciler.core.backup;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Usability of one recorded backup.
 *
 * @param info one line per disk that is missing from the backup, whose
 *             snapshot vanished, or that is no longer deployed
 */
public record BackupStatus(Availability status, List<String> info) {

    public BackupStatus {
        info = List.copyOf(info);
    }

    public enum Availability {
        COMPLETE,      // every recorded disk has a readable snapshot
        INCOMPLETE,    // some recorded disk was not part of the backup
        UNAVAILABLE;   // some snapshot cannot be used

        @JsonValue
        @Override
        public String toString() {
            return name().toLowerCase();
        }

        Availability worst(Availability other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }
}
