package com.scorekeeperapp.scoring.domain.game;

/**
 * When a game ends on its own.
 *
 * @param regulationInnings    innings in a full game
 * @param mercyRunDifferential lead that ends the game early; 0 turns the mercy rule off
 * @param mercyFromInning      first inning after which the mercy rule applies
 */
public record GameRules(int regulationInnings, int mercyRunDifferential, int mercyFromInning) {

    public GameRules {
        if (regulationInnings < 1) throw new IllegalArgumentException("regulationInnings must be >= 1");
        if (mercyRunDifferential < 0) throw new IllegalArgumentException("mercyRunDifferential must be >= 0");
        if (mercyFromInning < 1) throw new IllegalArgumentException("mercyFromInning must be >= 1");
    }

    public static GameRules defaults() {
        return new GameRules(7, 10, 5);
    }

    public boolean mercyApplies(int inning, int lead) {
        return mercyRunDifferential > 0 && inning >= mercyFromInning && lead >= mercyRunDifferential;
    }
}
