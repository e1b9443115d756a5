package com.scorekeeperapp.common.result;

public enum ErrorKind {
    NOT_FOUND,
    STRUCTURAL,
    RULE_NON_NEGOTIABLE,
    RULE_CONFIGURABLE,
    STATE_TRANSITION
}
