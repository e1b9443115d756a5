package com.scorekeeperapp.scoring.domain.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public class Scoreboard {

    private int homeRuns;
    private int awayRuns;
    private final Map<Integer, Integer> homeByInning = new TreeMap<>();
    private final Map<Integer, Integer> awayByInning = new TreeMap<>();

    public int getHomeRuns() {
        return homeRuns;
    }

    public int getAwayRuns() {
        return awayRuns;
    }

    public int runsFor(HomeAway side) {
        return side == HomeAway.HOME ? homeRuns : awayRuns;
    }

    /** Runs ahead of the other side; negative when trailing. */
    public int leadOf(HomeAway side) {
        return runsFor(side) - runsFor(side.opposite());
    }

    void openHalf(HomeAway side, int inning) {
        byInning(side).putIfAbsent(inning, 0);
    }

    void addRuns(HomeAway side, int inning, int runs) {
        if (runs < 0) throw new IllegalArgumentException("runs must be >= 0");
        byInning(side).merge(inning, runs, Integer::sum);
        if (side == HomeAway.HOME) {
            homeRuns += runs;
        } else {
            awayRuns += runs;
        }
    }

    public List<LineScoreEntry> lineScore() {
        TreeSet<Integer> innings = new TreeSet<>(awayByInning.keySet());
        innings.addAll(homeByInning.keySet());
        List<LineScoreEntry> entries = new ArrayList<>(innings.size());
        for (Integer inning : innings) {
            entries.add(new LineScoreEntry(inning, awayByInning.get(inning), homeByInning.get(inning)));
        }
        return entries;
    }

    private Map<Integer, Integer> byInning(HomeAway side) {
        return side == HomeAway.HOME ? homeByInning : awayByInning;
    }
}
