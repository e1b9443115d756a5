package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.common.result.ScoringError;

import java.util.LinkedHashMap;
import java.util.Map;

public record RuleViolation(RuleId rule, String message, Map<String, Object> details) {

    public RuleViolation {
        if (rule == null) throw new IllegalArgumentException("rule is required");
        if (message == null || message.isBlank()) throw new IllegalArgumentException("message is required");
        details = (details == null) ? Map.of() : Map.copyOf(details);
    }

    public static RuleViolation of(RuleId rule, String message) {
        return new RuleViolation(rule, message, Map.of());
    }

    public ScoringError toError() {
        Map<String, Object> withRule = new LinkedHashMap<>(details);
        withRule.put("rule", rule.name());
        return new ScoringError(rule.errorCode(), message, withRule);
    }
}
