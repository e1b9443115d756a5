package com.scorekeeperapp.scoring.dto.game.response;

import com.scorekeeperapp.scoring.domain.game.CompletionReason;
import com.scorekeeperapp.scoring.domain.game.GameStatus;
import com.scorekeeperapp.scoring.domain.game.HalfInning;
import com.scorekeeperapp.scoring.domain.game.HomeAway;

import java.util.List;

public record GameResponse(
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
        List<LineScoreResponse> lineScore,
        int nextBattingOrder,
        String nextBatterId,
        boolean lineupSet,
        CompletionReason completionReason
) {}
