package com.ratiowatch.backend.global.config;

import java.util.List;

import com.ratiowatch.backend.modules.ratio.domain.AgeGroupRule;
import com.ratiowatch.backend.modules.ratio.domain.RatioCalculator;
import com.ratiowatch.backend.modules.ratio.domain.RatioPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RatioPolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(RatioPolicyConfig.class);

    @Bean
    public RatioPolicy ratioPolicy(RatioProperties properties) {
        List<AgeGroupRule> rules = properties.getPolicy().getAgeGroups().stream()
                .map(group -> new AgeGroupRule(
                        group.getCode(),
                        group.getMaxChildrenPerStaff(),
                        group.getMinAgeMonths(),
                        group.getMaxAgeMonths()
                ))
                .toList();
        RatioPolicy policy = new RatioPolicy(rules);
        log.info("Loaded ratio policy {}", policy);
        return policy;
    }

    @Bean
    public RatioCalculator ratioCalculator(RatioPolicy ratioPolicy) {
        return new RatioCalculator(ratioPolicy);
    }
}
