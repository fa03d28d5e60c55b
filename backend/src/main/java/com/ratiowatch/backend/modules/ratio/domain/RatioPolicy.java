package com.ratiowatch.backend.modules.ratio.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable age group to ratio table. Built once at start-up from configuration and
 * handed to {@link RatioCalculator}; iteration order is the configured order.
 */
public final class RatioPolicy {

    private final Map<String, AgeGroupRule> rulesByCode;

    public RatioPolicy(List<AgeGroupRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("ratio policy must define at least one age group");
        }
        Map<String, AgeGroupRule> byCode = new LinkedHashMap<>();
        for (AgeGroupRule rule : rules) {
            if (byCode.putIfAbsent(rule.code(), rule) != null) {
                throw new IllegalArgumentException("duplicate age group in ratio policy: " + rule.code());
            }
        }
        this.rulesByCode = Collections.unmodifiableMap(byCode);
    }

    public Optional<AgeGroupRule> find(String ageGroup) {
        if (ageGroup == null || ageGroup.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulesByCode.get(AgeGroupRule.normalizeCode(ageGroup)));
    }

    public AgeGroupRule require(String ageGroup) {
        return find(ageGroup).orElseThrow(() -> new UnknownAgeGroupException(ageGroup));
    }

    public Optional<Integer> requiredRatio(String ageGroup) {
        return find(ageGroup).map(AgeGroupRule::maxChildrenPerStaff);
    }

    public List<AgeGroupRule> ageGroups() {
        return List.copyOf(rulesByCode.values());
    }

    public List<String> ageGroupCodes() {
        return List.copyOf(rulesByCode.keySet());
    }

    @Override
    public String toString() {
        return "RatioPolicy" + rulesByCode.values();
    }
}
