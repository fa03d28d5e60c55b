package com.ratiowatch.backend.modules.ratio.infrastructure.persistence;

import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RatioSnapshotRepositoryCustom {

    Page<RatioSnapshot> searchSnapshots(RatioSnapshotSearchCondition condition, Pageable pageable);
}
