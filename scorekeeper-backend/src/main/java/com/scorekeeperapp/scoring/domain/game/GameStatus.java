package com.scorekeeperapp.scoring.domain.game;

public enum GameStatus {
    SETUP,
    IN_PROGRESS,
    COMPLETED,
    SUSPENDED;

    public boolean canTransitionTo(GameStatus next) {
        return switch (this) {
            case SETUP -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == SUSPENDED;
            case COMPLETED, SUSPENDED -> false;
        };
    }
}
