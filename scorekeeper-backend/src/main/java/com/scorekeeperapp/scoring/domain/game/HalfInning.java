package com.scorekeeperapp.scoring.domain.game;

public enum HalfInning {
    TOP,
    BOTTOM;

    /** The visitors bat in the top half, the home side in the bottom. */
    public HomeAway battingSide() {
        return this == TOP ? HomeAway.AWAY : HomeAway.HOME;
    }

    public static HalfInning of(boolean top) {
        return top ? TOP : BOTTOM;
    }
}
