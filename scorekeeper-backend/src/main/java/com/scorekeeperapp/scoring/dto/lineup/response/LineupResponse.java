package com.scorekeeperapp.scoring.dto.lineup.response;

import java.util.List;

public record LineupResponse(
        String gameId,
        List<LineupSlotResponse> slots,
        List<String> substitutes
) {}
