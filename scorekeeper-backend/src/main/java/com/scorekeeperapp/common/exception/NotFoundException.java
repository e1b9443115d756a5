package com.scorekeeperapp.common.exception;

import com.scorekeeperapp.common.result.ScoringError;

import java.util.Collections;
import java.util.Map;

public class NotFoundException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public NotFoundException(String message) {
        this(message, "NOT_FOUND", null);
    }

    public NotFoundException(ScoringError error) {
        this(error.message(), error.code().name(), error.details());
    }

    public NotFoundException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? "NOT_FOUND" : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
