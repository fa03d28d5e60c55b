package com.ratiowatch.backend.modules.ratio.domain;

import org.springframework.http.HttpStatus;

import com.ratiowatch.backend.global.error.ProblemException;

public class DuplicateSnapshotException extends ProblemException {

    public static final String CODE = "DUPLICATE_SNAPSHOT";

    private final SnapshotKey key;

    public DuplicateSnapshotException(SnapshotKey key, Throwable cause) {
        super(HttpStatus.CONFLICT, CODE, "Snapshot already recorded for " + key, cause);
        this.key = key;
    }

    public SnapshotKey getKey() {
        return key;
    }
}
