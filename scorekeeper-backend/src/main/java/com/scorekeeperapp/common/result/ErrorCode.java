package com.scorekeeperapp.common.result;

/**
 * Stable failure codes returned by the scoring engine.
 * Callers branch on the code (or its {@link ErrorKind}), never on the message text.
 */
public enum ErrorCode {

    // not found
    GAME_NOT_FOUND(ErrorKind.NOT_FOUND),
    PLAYER_NOT_FOUND(ErrorKind.NOT_FOUND),

    // malformed commands
    BATTER_REQUIRED(ErrorKind.STRUCTURAL),
    INVALID_INNING(ErrorKind.STRUCTURAL),
    RESULT_REQUIRED(ErrorKind.STRUCTURAL),
    NEGATIVE_RBI(ErrorKind.STRUCTURAL),
    DESCRIPTION_TOO_LONG(ErrorKind.STRUCTURAL),
    BATTER_NOT_IN_LINEUP(ErrorKind.STRUCTURAL),
    OUTCOME_NOT_APPLICABLE(ErrorKind.STRUCTURAL),
    INVALID_RUNS(ErrorKind.STRUCTURAL),
    LINEUP_SIZE(ErrorKind.STRUCTURAL),
    BATTING_ORDER_INVALID(ErrorKind.STRUCTURAL),
    PLAYER_REQUIRED(ErrorKind.STRUCTURAL),
    DUPLICATE_LINEUP_PLAYER(ErrorKind.STRUCTURAL),
    DUPLICATE_POSITION(ErrorKind.STRUCTURAL),
    POSITIONS_UNFILLED(ErrorKind.STRUCTURAL),
    SUBSTITUTE_IN_LINEUP(ErrorKind.STRUCTURAL),
    DUPLICATE_SUBSTITUTE(ErrorKind.STRUCTURAL),
    NOT_A_SUBSTITUTE(ErrorKind.STRUCTURAL),

    // rules that always apply
    RBI_NOT_ALLOWED(ErrorKind.RULE_NON_NEGOTIABLE),
    RBI_MISMATCH(ErrorKind.RULE_NON_NEGOTIABLE),
    RBI_LIMIT_EXCEEDED(ErrorKind.RULE_NON_NEGOTIABLE),
    DUPLICATE_SCORER(ErrorKind.RULE_NON_NEGOTIABLE),
    HOME_RUN_BASES_NOT_CLEARED(ErrorKind.RULE_NON_NEGOTIABLE),
    INCONSISTENT_RUNNERS(ErrorKind.RULE_NON_NEGOTIABLE),
    RUNNER_PASSED(ErrorKind.RULE_NON_NEGOTIABLE),
    RBI_BOUND_VIOLATED(ErrorKind.RULE_NON_NEGOTIABLE),
    TOO_MANY_OUTS(ErrorKind.RULE_NON_NEGOTIABLE),

    // rules toggled by RuleConfiguration
    ERROR_RBI_NOT_ALLOWED(ErrorKind.RULE_CONFIGURABLE),
    OUTS_MISMATCH(ErrorKind.RULE_CONFIGURABLE),
    OUTCOME_NOT_PERMITTED(ErrorKind.RULE_CONFIGURABLE),

    // lifecycle
    GAME_NOT_IN_PROGRESS(ErrorKind.STATE_TRANSITION),
    ILLEGAL_STATUS_TRANSITION(ErrorKind.STATE_TRANSITION),
    LINEUP_REQUIRED(ErrorKind.STATE_TRANSITION),
    LINEUP_LOCKED(ErrorKind.STATE_TRANSITION),
    WRONG_HALF_INNING(ErrorKind.STATE_TRANSITION);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
