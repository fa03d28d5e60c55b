package com.ratiowatch.backend.modules.ratio.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.TypedQuery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.ratiowatch.backend.modules.ratio.domain.RatioSnapshot;

@Repository
public class RatioSnapshotRepositoryImpl implements RatioSnapshotRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<RatioSnapshot> searchSnapshots(RatioSnapshotSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");
        Objects.requireNonNull(condition.schoolPeriodId(), "schoolPeriodId must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        whereClauses.add("s.schoolPeriodId = :periodId");
        params.put("periodId", condition.schoolPeriodId());

        if (condition.date() != null) {
            whereClauses.add("s.snapshotDate = :date");
            params.put("date", condition.date());
        }
        if (condition.dateFrom() != null) {
            whereClauses.add("s.snapshotDate >= :dateFrom");
            params.put("dateFrom", condition.dateFrom());
        }
        if (condition.dateTo() != null) {
            whereClauses.add("s.snapshotDate <= :dateTo");
            params.put("dateTo", condition.dateTo());
        }
        if (StringUtils.hasText(condition.ageGroup())) {
            whereClauses.add("s.ageGroup = :ageGroup");
            params.put("ageGroup", condition.ageGroup());
        }
        if (StringUtils.hasText(condition.roomName())) {
            whereClauses.add("s.roomName = :roomName");
            params.put("roomName", condition.roomName());
        }
        if (condition.compliant() != null) {
            whereClauses.add("s.compliant = :compliant");
            params.put("compliant", condition.compliant());
        }
        if (condition.automatic() != null) {
            whereClauses.add("s.automatic = :automatic");
            params.put("automatic", condition.automatic());
        }
        if (condition.alertSent() != null) {
            whereClauses.add("s.alertSent = :alertSent");
            params.put("alertSent", condition.alertSent());
        }

        String whereJpql = " where " + String.join(" and ", whereClauses);

        Query countQuery = entityManager.createQuery("select count(s) from RatioSnapshot s" + whereJpql);
        applyParameters(countQuery, params);
        Number total = (Number) countQuery.getSingleResult();

        if (total.longValue() == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<RatioSnapshot> dataQuery = entityManager.createQuery(
                "select s from RatioSnapshot s" + whereJpql
                        + " order by s.snapshotDate desc, s.snapshotTime desc, s.ageGroup asc, s.id asc",
                RatioSnapshot.class);
        applyParameters(dataQuery, params);
        dataQuery.setFirstResult((int) pageable.getOffset());
        dataQuery.setMaxResults(pageable.getPageSize());

        return new PageImpl<>(dataQuery.getResultList(), pageable, total.longValue());
    }

    private static void applyParameters(Query query, Map<String, Object> params) {
        params.forEach(query::setParameter);
    }
}
