package com.scorekeeperapp.scoring.dto.advancement.response;

import com.scorekeeperapp.scoring.dto.common.BasesPayload;

import java.util.List;

public record AdvancementOutcomeResponse(
        BasesPayload baserunnersAfter,
        List<String> runsScored,
        int rbis,
        int outs
) {}
