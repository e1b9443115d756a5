package com.scorekeeperapp.scoring.domain.advancement;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a play: every violation found, plus the permitted outcomes when invalid.
 */
public record RuleValidation(List<RuleViolation> violations, List<AdvancementOutcome> suggestions) {

    public RuleValidation {
        violations = (violations == null) ? List.of() : List.copyOf(violations);
        suggestions = (suggestions == null) ? List.of() : List.copyOf(suggestions);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public Optional<RuleViolation> firstViolation() {
        return violations.stream().findFirst();
    }
}
