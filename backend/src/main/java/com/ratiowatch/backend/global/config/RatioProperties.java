package com.ratiowatch.backend.global.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ratio")
public class RatioProperties {

    private final Policy policy = new Policy();
    private final Alert alert = new Alert();
    private final Retention retention = new Retention();
    private final Scheduler scheduler = new Scheduler();

    public Policy getPolicy() {
        return policy;
    }

    public Alert getAlert() {
        return alert;
    }

    public Retention getRetention() {
        return retention;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Policy {

        private List<AgeGroup> ageGroups = new ArrayList<>();

        public List<AgeGroup> getAgeGroups() {
            return ageGroups;
        }

        public void setAgeGroups(List<AgeGroup> ageGroups) {
            this.ageGroups = ageGroups;
        }
    }

    public static class AgeGroup {

        private String code;
        private int maxChildrenPerStaff;
        private int minAgeMonths;
        private Integer maxAgeMonths;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public int getMaxChildrenPerStaff() {
            return maxChildrenPerStaff;
        }

        public void setMaxChildrenPerStaff(int maxChildrenPerStaff) {
            this.maxChildrenPerStaff = maxChildrenPerStaff;
        }

        public int getMinAgeMonths() {
            return minAgeMonths;
        }

        public void setMinAgeMonths(int minAgeMonths) {
            this.minAgeMonths = minAgeMonths;
        }

        public Integer getMaxAgeMonths() {
            return maxAgeMonths;
        }

        public void setMaxAgeMonths(Integer maxAgeMonths) {
            this.maxAgeMonths = maxAgeMonths;
        }
    }

    public static class Alert {

        /**
         * Compliant snapshots at or above this utilisation are reported as warnings.
         */
        private BigDecimal warningThresholdPercent = BigDecimal.valueOf(90);

        public BigDecimal getWarningThresholdPercent() {
            return warningThresholdPercent;
        }

        public void setWarningThresholdPercent(BigDecimal warningThresholdPercent) {
            this.warningThresholdPercent = warningThresholdPercent;
        }
    }

    public static class Retention {

        private int defaultDays = 365;

        public int getDefaultDays() {
            return defaultDays;
        }

        public void setDefaultDays(int defaultDays) {
            this.defaultDays = defaultDays;
        }
    }

    public static class Scheduler {

        private boolean enabled = false;
        private List<UUID> periodIds = new ArrayList<>();
        private Duration interval = Duration.ofMinutes(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<UUID> getPeriodIds() {
            return periodIds;
        }

        public void setPeriodIds(List<UUID> periodIds) {
            this.periodIds = periodIds;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
