package com.scorekeeperapp.scoring.domain.game;

public enum HomeAway {
    HOME,
    AWAY;

    public HomeAway opposite() {
        return this == HOME ? AWAY : HOME;
    }
}
