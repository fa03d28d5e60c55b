package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Turns head counts into a compliance verdict under a {@link RatioPolicy}.
 * Pure: no I/O, the only failure is an age group missing from the policy.
 */
public class RatioCalculator {

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RatioPolicy policy;

    public RatioCalculator(RatioPolicy policy) {
        this.policy = policy;
    }

    public RatioPolicy getPolicy() {
        return policy;
    }

    public RatioEvaluation evaluate(String ageGroup, int staffCount, int childCount) {
        return evaluate(ageGroup, null, PresenceCount.of(staffCount, childCount), null);
    }

    public RatioEvaluation evaluate(String ageGroup, String roomName, PresenceCount presence, LocalDateTime calculatedAt) {
        AgeGroupRule rule = policy.require(ageGroup);
        int required = rule.maxChildrenPerStaff();
        int staff = presence.staffCount();
        int children = presence.childCount();
        long capacity = (long) staff * required;

        ActualRatio actualRatio = actualRatio(staff, children);
        // compared on integers so the 2-decimal rounding of the ratio cannot flip the verdict
        boolean compliant = children == 0 || (staff > 0 && children <= capacity);

        BigDecimal compliancePercent = BigDecimal.ZERO.setScale(SCALE);
        if (staff > 0 && children > 0) {
            compliancePercent = BigDecimal.valueOf(children)
                    .multiply(HUNDRED)
                    .divide(BigDecimal.valueOf(capacity), SCALE, RoundingMode.HALF_UP);
        }

        int staffNeeded = 0;
        if (!compliant) {
            staffNeeded = ceilDiv(children, required) - staff;
        }

        int additionalCapacity = 0;
        if (compliant && staff > 0) {
            additionalCapacity = (int) Math.max(0, capacity - children);
        }

        return new RatioEvaluation(
                rule.code(),
                roomName,
                staff,
                children,
                required,
                actualRatio,
                compliant,
                compliancePercent,
                staffNeeded,
                additionalCapacity,
                roomName != null && presence.childCountApproximate(),
                calculatedAt
        );
    }

    private static ActualRatio actualRatio(int staff, int children) {
        if (staff > 0) {
            return ActualRatio.of(BigDecimal.valueOf(children)
                    .divide(BigDecimal.valueOf(staff), SCALE, RoundingMode.HALF_UP));
        }
        return children > 0 ? ActualRatio.UNBOUNDED : ActualRatio.ZERO;
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
