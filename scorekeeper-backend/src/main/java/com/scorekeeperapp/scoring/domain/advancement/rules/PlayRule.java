package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;

import java.util.List;

/**
 * One validation rule over a proposed play.
 * Non-negotiable rules are always enabled; configurable ones read their switch from the configuration.
 */
public interface PlayRule {

    RuleId id();

    default boolean isEnabled(RuleConfiguration configuration) {
        return true;
    }

    /** Every breach of this rule by the scenario; empty when it holds. */
    List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration);
}
