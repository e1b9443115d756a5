package com.scorekeeperapp.scoring.dto.atbat.request;

import com.scorekeeperapp.scoring.domain.advancement.Aggressiveness;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RecordAtBatRequest(
        @NotBlank String gameId,
        @NotBlank String batterId,
        @NotNull Integer inning,
        @NotNull Boolean topOfInning,
        @NotNull BattingResult result,
        String description,
        @NotNull Integer rbis,
        BasesPayload baserunnersBefore,
        BasesPayload baserunnersAfter,
        List<String> runsScored,
        Aggressiveness aggressiveness,
        Boolean errorOccurred,
        Boolean runningErrorOccurred
) {}
