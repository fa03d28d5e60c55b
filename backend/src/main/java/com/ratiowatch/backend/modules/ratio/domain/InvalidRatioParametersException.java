package com.ratiowatch.backend.modules.ratio.domain;

import org.springframework.http.HttpStatus;

import com.ratiowatch.backend.global.error.ProblemException;

public class InvalidRatioParametersException extends ProblemException {

    public static final String CODE = "INVALID_PARAMETERS";

    public InvalidRatioParametersException(String detail) {
        super(HttpStatus.BAD_REQUEST, CODE, detail);
    }
}
