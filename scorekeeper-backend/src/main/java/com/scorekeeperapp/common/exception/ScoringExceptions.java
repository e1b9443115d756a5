package com.scorekeeperapp.common.exception;

import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.common.result.ScoringError;

public final class ScoringExceptions {

    private ScoringExceptions() {}

    /** Returns the value of a successful result or throws the exception matching the error kind. */
    public static <T> T unwrap(Result<T> result) {
        return result.orElseThrow(ScoringExceptions::toException);
    }

    public static RuntimeException toException(ScoringError error) {
        return switch (error.kind()) {
            case NOT_FOUND -> new NotFoundException(error);
            case STRUCTURAL -> new BadRequestException(error);
            case RULE_NON_NEGOTIABLE, RULE_CONFIGURABLE -> new RuleViolationException(error);
            case STATE_TRANSITION -> new ConflictException(error);
        };
    }
}
