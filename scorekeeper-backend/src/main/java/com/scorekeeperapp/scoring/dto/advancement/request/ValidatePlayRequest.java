package com.scorekeeperapp.scoring.dto.advancement.request;

import com.scorekeeperapp.scoring.domain.advancement.Aggressiveness;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ValidatePlayRequest(
        BasesPayload baserunnersBefore,
        @NotNull BattingResult result,
        @NotBlank String batterId,
        Aggressiveness aggressiveness,
        Boolean errorOccurred,
        Boolean runningErrorOccurred,
        BasesPayload baserunnersAfter,
        List<String> runsScored,
        @NotNull Integer rbis,
        @Min(0) @Max(2) Integer outsBeforePlay
) {}
