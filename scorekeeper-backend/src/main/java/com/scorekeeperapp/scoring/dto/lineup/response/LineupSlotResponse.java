package com.scorekeeperapp.scoring.dto.lineup.response;

import com.scorekeeperapp.scoring.domain.lineup.Position;

public record LineupSlotResponse(
        int battingOrder,
        String playerId,
        Position position
) {}
