package com.ratiowatch.backend.modules.ratio.domain;

import org.springframework.http.HttpStatus;

import com.ratiowatch.backend.global.error.ProblemException;

public class UnknownAgeGroupException extends ProblemException {

    public static final String CODE = "UNKNOWN_AGE_GROUP";

    private final String ageGroup;

    public UnknownAgeGroupException(String ageGroup) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, "No ratio policy configured for age group '" + ageGroup + "'");
        this.ageGroup = ageGroup;
    }

    public String getAgeGroup() {
        return ageGroup;
    }
}
