package com.scorekeeperapp.common.exception;

import com.scorekeeperapp.common.result.ErrorKind;
import com.scorekeeperapp.common.result.ScoringError;
import lombok.Getter;

/**
 * A play that breaks a scoring rule. The kind says whether the rule can be switched off.
 */
@Getter
public class RuleViolationException extends BadRequestException {

    private final ErrorKind kind;

    public RuleViolationException(ScoringError error) {
        super(error);
        this.kind = error.kind();
    }
}
