package com.scorekeeperapp.scoring.dto.advancement.response;

import java.util.Map;

public record RuleViolationResponse(
        String rule,
        String errorCode,
        boolean nonNegotiable,
        String message,
        Map<String, Object> details
) {}
