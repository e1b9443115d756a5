package com.scorekeeperapp.scoring.dto.lineup.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SubstitutePlayerRequest(
        @NotBlank String gameId,
        @NotNull @Min(1) @Max(9) Integer battingOrder,
        @NotBlank String substituteId
) {}
