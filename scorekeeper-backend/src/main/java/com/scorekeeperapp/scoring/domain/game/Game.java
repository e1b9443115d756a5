package com.scorekeeperapp.scoring.domain.game;

import com.scorekeeperapp.scoring.domain.lineup.Lineup;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable game aggregate. Status, innings and score change only through {@link GameProgression};
 * the lineup only through lineup setup and substitution.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@Builder
public class Game {

    private final String id;
    private final String name;
    private final String opponent;
    private final HomeAway ourSide;
    private final GameRules rules;
    private final Instant createdAt;

    @Builder.Default
    private GameStatus status = GameStatus.SETUP;

    @Setter(AccessLevel.NONE)
    private Lineup lineup;

    @Builder.Default
    private Scoreboard scoreboard = new Scoreboard();

    private Inning currentInning;

    @Builder.Default
    private List<Inning> completedInnings = new ArrayList<>();

    @Builder.Default
    private int nextBattingOrder = 1;

    private CompletionReason completionReason;
    private Instant startedAt;
    private Instant endedAt;

    public static Game create(String id, String name, String opponent, HomeAway ourSide, GameRules rules,
                              Instant createdAt) {
        return Game.builder()
                .id(id)
                .name(name)
                .opponent(opponent)
                .ourSide(ourSide)
                .rules(rules == null ? GameRules.defaults() : rules)
                .createdAt(createdAt)
                .build();
    }

    public boolean isInProgress() {
        return status == GameStatus.IN_PROGRESS;
    }

    public HomeAway battingSide() {
        return currentInning == null ? null : currentInning.battingSide();
    }

    public boolean isOurHalf() {
        return currentInning != null && !currentInning.isComplete() && currentInning.battingSide() == ourSide;
    }

    public String nextBatterId() {
        return lineup == null ? null : lineup.slot(nextBattingOrder).playerId();
    }

    public List<Inning> getCompletedInnings() {
        return Collections.unmodifiableList(completedInnings);
    }

    /** Attaches a validated starting lineup; only legal before the game starts. */
    public void attachLineup(Lineup validated) {
        if (status != GameStatus.SETUP) {
            throw new IllegalStateException("Lineup can only be set while the game is in setup");
        }
        this.lineup = validated;
    }

    /** Swaps in a lineup with a substitution applied. */
    public void replaceLineup(Lineup updated) {
        if (status != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException("Substitutions are only allowed while the game is in progress");
        }
        this.lineup = updated;
    }

    void advanceBattingOrder(int lastBattingPosition) {
        this.nextBattingOrder = lastBattingPosition % Lineup.SIZE + 1;
    }

    void archiveCurrentInning() {
        if (currentInning != null && !completedInnings.contains(currentInning)) {
            completedInnings.add(currentInning);
        }
    }
}
