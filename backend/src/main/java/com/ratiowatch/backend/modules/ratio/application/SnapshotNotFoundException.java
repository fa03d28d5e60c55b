package com.ratiowatch.backend.modules.ratio.application;

import java.util.UUID;

import org.springframework.http.HttpStatus;

import com.ratiowatch.backend.global.error.ProblemException;

public class SnapshotNotFoundException extends ProblemException {

    public static final String CODE = "SNAPSHOT_NOT_FOUND";

    public SnapshotNotFoundException(UUID snapshotId) {
        super(HttpStatus.NOT_FOUND, CODE, "Snapshot " + snapshotId + " not found");
    }
}
