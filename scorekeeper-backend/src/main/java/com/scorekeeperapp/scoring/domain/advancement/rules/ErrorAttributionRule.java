package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementCalculator;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementOutcome;
import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.List;
import java.util.Map;

/**
 * On a play involving a fielding error the batter is credited with no more RBIs
 * than the same play without the error would have earned.
 */
public class ErrorAttributionRule implements PlayRule {

    private final AdvancementCalculator calculator;

    public ErrorAttributionRule(AdvancementCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public RuleId id() {
        return RuleId.ERROR_ATTRIBUTION;
    }

    @Override
    public boolean isEnabled(RuleConfiguration configuration) {
        return configuration.errorAttribution();
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        boolean errorPlay = scenario.parameters().errorOccurred() || scenario.result() == BattingResult.ERROR;
        if (!errorPlay) return List.of();

        Result<AdvancementOutcome> clean = calculator.standardAdvancement(
                scenario.baserunnersBefore(), scenario.result(), scenario.batterId(), configuration);
        if (clean.isFailure()) return List.of();

        int allowed = clean.getValue().rbis();
        if (scenario.rbis() > allowed) {
            return List.of(new RuleViolation(id(),
                    "Runs that score because of an error are not RBIs; at most " + allowed + " RBI(s) allowed",
                    Map.of("rbis", scenario.rbis(), "allowedRbis", allowed)));
        }
        return List.of();
    }
}
