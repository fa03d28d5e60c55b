package com.ratiowatch.backend.modules.ratio.application;

import java.util.UUID;

public record SnapshotOutcome(Status status, UUID snapshotId, String errorCode, String message) {

    public enum Status {
        RECORDED,
        DUPLICATE,
        FAILED
    }

    public static SnapshotOutcome recorded(UUID snapshotId) {
        return new SnapshotOutcome(Status.RECORDED, snapshotId, null, null);
    }

    public static SnapshotOutcome duplicate(String errorCode, String message) {
        return new SnapshotOutcome(Status.DUPLICATE, null, errorCode, message);
    }

    public static SnapshotOutcome failed(String errorCode, String message) {
        return new SnapshotOutcome(Status.FAILED, null, errorCode, message);
    }
}
