package com.scorekeeperapp.scoring.dto.game.request;

import jakarta.validation.constraints.NotBlank;

public record GameActionRequest(
        @NotBlank String gameId
) {}
