package com.scorekeeperapp.scoring.dto.game.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RecordOpponentHalfInningRequest(
        @NotBlank String gameId,
        @NotNull @Min(0) Integer runs
) {}
