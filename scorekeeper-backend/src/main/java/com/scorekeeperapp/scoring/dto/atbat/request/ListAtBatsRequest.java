package com.scorekeeperapp.scoring.dto.atbat.request;

import jakarta.validation.constraints.NotBlank;

public record ListAtBatsRequest(
        @NotBlank String gameId
) {}
