package com.vmreconciler.core.slot;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Maps logical device paths to numeric attachment slots (LUNs) and back.
 *
 * <p>Only {@code /dev/disk/by-lun/N} with {@code N} in 0..31 names a slot. The
 * root path {@value #ROOT_DEVICE} names the OS disk and has no slot; callers
 * test for it with {@link #isRoot} before asking for a slot.
 */
public final class SlotAddressing {

    public static final String ROOT_DEVICE = "/dev/sda";
    public static final int MAX_SLOT = 31;

    private static final String SLOT_PREFIX = "/dev/disk/by-lun/";
    private static final Pattern SLOT_DEVICE = Pattern.compile("/dev/disk/by-lun/(\\d+)");

    private SlotAddressing() {}

    public static OptionalInt deviceToSlot(String device) {
        if (device == null) {
            return OptionalInt.empty();
        }
        var matcher = SLOT_DEVICE.matcher(device);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        var digits = matcher.group(1);
        // anything longer cannot be <= 31 and may not fit an int
        if (digits.length() > 3) {
            return OptionalInt.empty();
        }
        int slot = Integer.parseInt(digits);
        return slot > MAX_SLOT ? OptionalInt.empty() : OptionalInt.of(slot);
    }

    public static String slotToDevice(int slot) {
        return SLOT_PREFIX + slot;
    }

    public static boolean isRoot(String device) {
        return ROOT_DEVICE.equals(device);
    }

    public static boolean isValidDevice(String device) {
        return isRoot(device) || deviceToSlot(device).isPresent();
    }
}
