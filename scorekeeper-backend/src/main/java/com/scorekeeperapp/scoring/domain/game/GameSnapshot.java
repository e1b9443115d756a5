package com.scorekeeperapp.scoring.domain.game;

import java.util.List;

/**
 * Immutable read view of a game, taken while the game is not being written.
 */
public record GameSnapshot(
        String id,
        String name,
        String opponent,
        HomeAway ourSide,
        GameStatus status,
        Integer inning,
        HalfInning half,
        HomeAway battingSide,
        int outs,
        int homeRuns,
        int awayRuns,
        List<LineScoreEntry> lineScore,
        int nextBattingOrder,
        String nextBatterId,
        boolean lineupSet,
        CompletionReason completionReason
) {

    public GameSnapshot {
        lineScore = (lineScore == null) ? List.of() : List.copyOf(lineScore);
    }

    public static GameSnapshot of(Game game) {
        Inning inning = game.getCurrentInning();
        return new GameSnapshot(
                game.getId(),
                game.getName(),
                game.getOpponent(),
                game.getOurSide(),
                game.getStatus(),
                inning == null ? null : inning.getNumber(),
                inning == null ? null : inning.getHalf(),
                inning == null ? null : inning.battingSide(),
                inning == null ? 0 : inning.getOuts(),
                game.getScoreboard().getHomeRuns(),
                game.getScoreboard().getAwayRuns(),
                game.getScoreboard().lineScore(),
                game.getNextBattingOrder(),
                game.nextBatterId(),
                game.getLineup() != null,
                game.getCompletionReason()
        );
    }
}
