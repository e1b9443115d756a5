package com.scorekeeperapp.scoring.domain.game;

/** Runs per side for one inning; a side that did not bat has null. */
public record LineScoreEntry(int inning, Integer awayRuns, Integer homeRuns) {}
