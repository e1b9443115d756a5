package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.ErrorKind;

public enum RuleId {

    RUNNER_CONSISTENCY(ErrorCode.INCONSISTENT_RUNNERS),
    NO_RUNNER_PASSING(ErrorCode.RUNNER_PASSED),
    RBI_BOUND(ErrorCode.RBI_BOUND_VIOLATED),
    MAX_OUTS_PER_PLAY(ErrorCode.TOO_MANY_OUTS),
    ERROR_ATTRIBUTION(ErrorCode.ERROR_RBI_NOT_ALLOWED),
    OUTS_ACCOUNTING(ErrorCode.OUTS_MISMATCH),
    OUTCOME_MATRIX(ErrorCode.OUTCOME_NOT_PERMITTED);

    private final ErrorCode errorCode;

    RuleId(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isNonNegotiable() {
        return errorCode.kind() == ErrorKind.RULE_NON_NEGOTIABLE;
    }
}
