package com.scorekeeperapp.scoring.dto.player.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterPlayerRequest(
        @NotBlank @Size(max = 80) String name
) {}
