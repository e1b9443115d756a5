package com.scorekeeperapp.common.exception;

import com.scorekeeperapp.common.result.ScoringError;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * The request is well formed but the game is in the wrong state for it.
 */
@Getter
public class ConflictException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public ConflictException(ScoringError error) {
        this(error.message(), error.code().name(), error.details());
    }

    public ConflictException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? "CONFLICT" : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }
}
