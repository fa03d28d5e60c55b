package com.ratiowatch.backend.modules.ratio.domain;

/**
 * @param requiredRatio the currently configured ratio, {@code null} if the group has been removed from the policy
 */
public record AgeGroupComplianceSummary(String ageGroup, Integer requiredRatio, ComplianceStats stats) {
}
