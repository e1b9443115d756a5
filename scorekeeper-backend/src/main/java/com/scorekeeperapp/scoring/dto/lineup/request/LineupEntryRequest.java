package com.scorekeeperapp.scoring.dto.lineup.request;

import com.scorekeeperapp.scoring.domain.lineup.Position;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LineupEntryRequest(
        @NotNull Integer battingOrder,
        @NotBlank String playerId,
        @NotNull Position position
) {}
