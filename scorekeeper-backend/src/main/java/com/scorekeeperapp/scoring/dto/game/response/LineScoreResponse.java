package com.scorekeeperapp.scoring.dto.game.response;

public record LineScoreResponse(
        int inning,
        Integer awayRuns,
        Integer homeRuns
) {}
