package com.ratiowatch.backend.modules.ratio.domain;

import java.util.Locale;

/**
 * One row of the ratio policy: the regulatory children-per-staff ceiling for an age group
 * and the age bracket, in whole months, that places a child in it.
 *
 * @param code                 normalized age-group code, e.g. {@code TODDLER}
 * @param maxChildrenPerStaff  required ratio, children per staff member
 * @param minAgeMonths         inclusive lower bound of the bracket
 * @param maxAgeMonths         exclusive upper bound, {@code null} when the bracket is open-ended
 */
public record AgeGroupRule(
        String code,
        int maxChildrenPerStaff,
        int minAgeMonths,
        Integer maxAgeMonths
) {

    public AgeGroupRule {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("age group code must not be blank");
        }
        code = normalizeCode(code);
        if (maxChildrenPerStaff <= 0) {
            throw new IllegalArgumentException("maxChildrenPerStaff must be positive for " + code);
        }
        if (minAgeMonths < 0) {
            throw new IllegalArgumentException("minAgeMonths must be >= 0 for " + code);
        }
        if (maxAgeMonths != null && maxAgeMonths <= minAgeMonths) {
            throw new IllegalArgumentException("maxAgeMonths must be greater than minAgeMonths for " + code);
        }
    }

    public boolean includesAgeInMonths(long ageInMonths) {
        if (ageInMonths < minAgeMonths) {
            return false;
        }
        return maxAgeMonths == null || ageInMonths < maxAgeMonths;
    }

    /**
     * "School Age", "school-age" and "SCHOOL_AGE" all map to {@code SCHOOL_AGE}.
     */
    public static String normalizeCode(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.trim()
                .replaceAll("[\\s\\-]+", "_")
                .toUpperCase(Locale.ROOT);
    }
}
