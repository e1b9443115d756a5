package com.scorekeeperapp.scoring.dto.advancement.response;

import java.util.List;

public record PlayValidationResponse(
        boolean valid,
        List<RuleViolationResponse> violations,
        List<AdvancementOutcomeResponse> suggestions
) {}
