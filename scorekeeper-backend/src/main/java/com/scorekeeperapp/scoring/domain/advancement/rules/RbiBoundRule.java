package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.List;
import java.util.Map;

public class RbiBoundRule implements PlayRule {

    @Override
    public RuleId id() {
        return RuleId.RBI_BOUND;
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        int rbis = scenario.rbis();
        int scorers = scenario.distinctScorers().size();
        Map<String, Object> details = Map.of("rbis", rbis, "runsScored", scorers);

        if (rbis < 0 || rbis > BattingResult.MAX_RBIS_PER_PLAY) {
            return List.of(new RuleViolation(id(),
                    "RBIs must be between 0 and " + BattingResult.MAX_RBIS_PER_PLAY, details));
        }

        boolean exempt = configuration.isRbiExempt(scenario.result(), scenario.parameters().errorOccurred());
        if (exempt && rbis > scorers) {
            return List.of(new RuleViolation(id(), "RBI count cannot exceed runs scored", details));
        }
        if (!exempt && rbis != scorers) {
            return List.of(new RuleViolation(id(), "RBI count must match runs scored", details));
        }
        return List.of();
    }
}
