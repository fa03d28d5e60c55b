package com.ratiowatch.backend.modules.ratio.domain;

import org.springframework.http.HttpStatus;

import com.ratiowatch.backend.global.error.RetryableProblemException;

public class PresenceDataUnavailableException extends RetryableProblemException {

    public static final String CODE = "PRESENCE_DATA_UNAVAILABLE";
    private static final int RETRY_AFTER_SECONDS = 30;

    public PresenceDataUnavailableException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, RETRY_AFTER_SECONDS, cause);
    }
}
