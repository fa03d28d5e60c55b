package com.ratiowatch.backend.modules.ratio.domain;

/**
 * Head counts at one instant. {@code childCountApproximate} is set when a room-scoped count
 * was requested but children could only be counted for the whole age group.
 */
public record PresenceCount(int staffCount, int childCount, boolean childCountApproximate) {

    public PresenceCount {
        if (staffCount < 0 || childCount < 0) {
            throw new InvalidRatioParametersException("presence counts must not be negative");
        }
    }

    public static PresenceCount of(int staffCount, int childCount) {
        return new PresenceCount(staffCount, childCount, false);
    }
}
