package com.scorekeeperapp.scoring.dto.atbat.response;

import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;

import java.time.Instant;
import java.util.List;

public record AtBatResponse(
        String id,
        String gameId,
        String inningId,
        String batterId,
        int battingPosition,
        BattingResult result,
        String resultCode,
        String description,
        int rbis,
        List<String> runsScored,
        BasesPayload baserunnersBefore,
        BasesPayload baserunnersAfter,
        int outsOnPlay,
        Instant timestamp
) {}
