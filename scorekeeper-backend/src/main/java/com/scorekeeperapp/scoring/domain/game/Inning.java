package com.scorekeeperapp.scoring.domain.game;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One half-inning. Mutated only through {@link GameProgression}.
 */
@Getter
@Builder
public class Inning {

    public static final int MAX_OUTS = 3;

    private final String id;
    private final String gameId;
    private final int number;
    private final HalfInning half;

    @Builder.Default
    private final List<String> atBatIds = new ArrayList<>();

    private int outs;
    private int runs;
    private boolean complete;

    public HomeAway battingSide() {
        return half.battingSide();
    }

    public boolean isTop() {
        return half == HalfInning.TOP;
    }

    public List<String> getAtBatIds() {
        return Collections.unmodifiableList(atBatIds);
    }

    void recordPlay(String atBatId, int runsOnPlay, int outsOnPlay) {
        if (complete) throw new IllegalStateException("Inning " + number + " " + half + " is already complete");
        atBatIds.add(atBatId);
        runs += runsOnPlay;
        outs = Math.min(MAX_OUTS, outs + outsOnPlay);
    }

    void recordRuns(int runsInHalf) {
        runs += runsInHalf;
    }

    void close(boolean retireSide) {
        if (retireSide) outs = MAX_OUTS;
        complete = true;
    }
}
