package com.scorekeeperapp.scoring.dto.lineup.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

// entry count and batting orders are checked by the lineup validator so the caller gets its messages
public record SetupLineupRequest(
        @NotBlank String gameId,
        @NotNull @Valid List<LineupEntryRequest> entries,
        List<String> substitutes
) {}
