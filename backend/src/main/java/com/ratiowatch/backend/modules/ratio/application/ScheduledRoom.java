package com.ratiowatch.backend.modules.ratio.application;

/**
 * A room with at least one non-cancelled duty schedule covering the instant, and the age
 * group that schedule is for. The age group may be outside the policy (e.g. {@code MIXED}).
 */
public record ScheduledRoom(String roomName, String ageGroup) {
}
