package com.scorekeeperapp.scoring.domain.game;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Game lifecycle and half-inning state machine.
 *
 * Status: SETUP -> IN_PROGRESS -> COMPLETED, and IN_PROGRESS -> SUSPENDED. Nothing else is legal.
 * Within a game, three outs close the half-inning, the batting side flips and the inning number
 * moves on after the bottom half. The game ends on regulation, walk-off or the mercy rule.
 */
public class GameProgression {

    private final Clock clock;

    public GameProgression(Clock clock) {
        this.clock = clock;
    }

    public Result<Void> start(Game game) {
        Result<Void> allowed = checkTransition(game, GameStatus.IN_PROGRESS);
        if (allowed.isFailure()) return allowed;
        if (game.getLineup() == null) {
            return Result.failure(ErrorCode.LINEUP_REQUIRED, "A validated lineup is required before the game can start",
                    Map.of("gameId", game.getId()));
        }

        game.setStatus(GameStatus.IN_PROGRESS);
        game.setStartedAt(clock.instant());
        openHalf(game, 1, HalfInning.TOP);
        return Result.success();
    }

    public Result<Void> suspend(Game game) {
        Result<Void> allowed = checkTransition(game, GameStatus.SUSPENDED);
        if (allowed.isFailure()) return allowed;
        game.setStatus(GameStatus.SUSPENDED);
        game.setEndedAt(clock.instant());
        return Result.success();
    }

    /** Ends the game before its natural end, e.g. time limit or weather. */
    public Result<Void> complete(Game game) {
        Result<Void> allowed = checkTransition(game, GameStatus.COMPLETED);
        if (allowed.isFailure()) return allowed;
        finish(game, CompletionReason.CALLED);
        return Result.success();
    }

    /**
     * Applies a play that has already been validated for the current half-inning.
     */
    public void applyPlay(Game game, String atBatId, int battingPosition, int runs, int outs) {
        if (!game.isInProgress()) {
            throw new IllegalStateException("Game " + game.getId() + " is not in progress");
        }
        Inning inning = game.getCurrentInning();
        inning.recordPlay(atBatId, runs, outs);
        game.getScoreboard().addRuns(inning.battingSide(), inning.getNumber(), runs);
        game.advanceBattingOrder(battingPosition);

        if (isWalkOff(game)) {
            inning.close(false);
            game.archiveCurrentInning();
            finish(game, CompletionReason.WALK_OFF);
        } else if (inning.getOuts() >= Inning.MAX_OUTS) {
            endHalfInning(game);
        }
    }

    /**
     * Records the opponent's half-inning as a single run total and closes it.
     */
    public Result<Void> recordOpponentHalfInning(Game game, int runs) {
        if (!game.isInProgress()) {
            return Result.failure(ErrorCode.GAME_NOT_IN_PROGRESS, "Game is not in progress",
                    Map.of("status", game.getStatus().name()));
        }
        if (runs < 0) {
            return Result.failure(ErrorCode.INVALID_RUNS, "Runs cannot be negative", Map.of("runs", runs));
        }
        Inning inning = game.getCurrentInning();
        if (inning.battingSide() == game.getOurSide()) {
            return Result.failure(ErrorCode.WRONG_HALF_INNING,
                    "Our team is batting; record its plate appearances instead",
                    Map.of("inning", inning.getNumber(), "half", inning.getHalf().name()));
        }

        inning.recordRuns(runs);
        game.getScoreboard().addRuns(inning.battingSide(), inning.getNumber(), runs);
        if (isWalkOff(game)) {
            inning.close(false);
            game.archiveCurrentInning();
            finish(game, CompletionReason.WALK_OFF);
        } else {
            inning.close(true);
            endHalfInning(game);
        }
        return Result.success();
    }

    void endHalfInning(Game game) {
        Inning finished = game.getCurrentInning();
        finished.close(false);
        game.archiveCurrentInning();

        Optional<CompletionReason> ending = endCondition(game, finished);
        if (ending.isPresent()) {
            finish(game, ending.get());
        } else if (finished.isTop()) {
            openHalf(game, finished.getNumber(), HalfInning.BOTTOM);
        } else {
            openHalf(game, finished.getNumber() + 1, HalfInning.TOP);
        }
    }

    private Optional<CompletionReason> endCondition(Game game, Inning finished) {
        GameRules rules = game.getRules();
        int inning = finished.getNumber();
        int homeLead = game.getScoreboard().leadOf(HomeAway.HOME);

        if (finished.isTop()) {
            // the home side does not need its last at-bats when already ahead
            if (inning >= rules.regulationInnings() && homeLead > 0) return Optional.of(CompletionReason.REGULATION);
            if (rules.mercyApplies(inning, homeLead)) return Optional.of(CompletionReason.MERCY_RULE);
            return Optional.empty();
        }
        if (inning >= rules.regulationInnings() && homeLead != 0) return Optional.of(CompletionReason.REGULATION);
        if (rules.mercyApplies(inning, Math.abs(homeLead))) return Optional.of(CompletionReason.MERCY_RULE);
        return Optional.empty();
    }

    private boolean isWalkOff(Game game) {
        Inning inning = game.getCurrentInning();
        return inning.getHalf() == HalfInning.BOTTOM
                && inning.getNumber() >= game.getRules().regulationInnings()
                && game.getScoreboard().leadOf(HomeAway.HOME) > 0;
    }

    private void openHalf(Game game, int number, HalfInning half) {
        Inning inning = Inning.builder()
                .id(UUID.randomUUID().toString())
                .gameId(game.getId())
                .number(number)
                .half(half)
                .build();
        game.setCurrentInning(inning);
        game.getScoreboard().openHalf(half.battingSide(), number);
    }

    private void finish(Game game, CompletionReason reason) {
        game.setStatus(GameStatus.COMPLETED);
        game.setCompletionReason(reason);
        game.setEndedAt(clock.instant());
    }

    private Result<Void> checkTransition(Game game, GameStatus target) {
        if (game.getStatus().canTransitionTo(target)) return Result.success();
        return Result.failure(ErrorCode.ILLEGAL_STATUS_TRANSITION,
                "Cannot move a game from " + game.getStatus() + " to " + target,
                Map.of("from", game.getStatus().name(), "to", target.name()));
    }
}
