package com.scorekeeperapp.scoring.domain.game;

public enum CompletionReason {
    REGULATION,
    WALK_OFF,
    MERCY_RULE,
    CALLED
}
