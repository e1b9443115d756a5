package com.scorekeeperapp.scoring.dto.game.request;

import com.scorekeeperapp.scoring.domain.game.HomeAway;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateGameRequest(
        @NotBlank @Size(max = 80) String name,
        @NotBlank @Size(max = 80) String opponent,
        @NotNull HomeAway ourSide
) {}
