package com.ratiowatch.backend.modules.ratio.application;

import com.ratiowatch.backend.modules.ratio.domain.DuplicateSnapshotException;
import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;
import com.ratiowatch.backend.modules.ratio.infrastructure.persistence.RatioSnapshotRepository;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts one snapshot in its own transaction. The unique key is checked by the database
 * only, so concurrent writers of the same key end with exactly one row.
 */
@Component
public class RatioSnapshotRecorder {

    static final String SNAPSHOT_KEY_CONSTRAINT = "uq_ratio_snapshot_key";

    private final RatioSnapshotRepository ratioSnapshotRepository;

    public RatioSnapshotRecorder(RatioSnapshotRepository ratioSnapshotRepository) {
        this.ratioSnapshotRepository = ratioSnapshotRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RatioSnapshot insert(RatioSnapshot snapshot) {
        try {
            return ratioSnapshotRepository.saveAndFlush(snapshot);
        } catch (DataIntegrityViolationException ex) {
            if (isSnapshotKeyViolation(ex)) {
                throw new DuplicateSnapshotException(snapshot.key(), ex);
            }
            throw ex;
        }
    }

    private boolean isSnapshotKeyViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(SNAPSHOT_KEY_CONSTRAINT);
    }
}
