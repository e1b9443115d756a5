package com.scorekeeperapp.scoring.dto.advancement.request;

import com.scorekeeperapp.scoring.domain.advancement.Aggressiveness;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AdvancementRequest(
        BasesPayload baserunnersBefore,
        @NotNull BattingResult result,
        @NotBlank String batterId,
        Aggressiveness aggressiveness,
        Boolean errorOccurred,
        Boolean runningErrorOccurred
) {}
