package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;

import java.util.List;
import java.util.Map;

public class MaxOutsPerPlayRule implements PlayRule {

    public static final int OUTS_PER_HALF_INNING = 3;

    @Override
    public RuleId id() {
        return RuleId.MAX_OUTS_PER_PLAY;
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        int outs = scenario.outsOnPlay();
        int remaining = OUTS_PER_HALF_INNING - scenario.outsBeforePlay();
        Map<String, Object> details = Map.of("outsOnPlay", outs, "outsBeforePlay", scenario.outsBeforePlay());

        if (outs > OUTS_PER_HALF_INNING) {
            return List.of(new RuleViolation(id(),
                    "A single play cannot record more than " + OUTS_PER_HALF_INNING + " outs", details));
        }
        if (outs > remaining) {
            return List.of(new RuleViolation(id(),
                    "Only " + remaining + " out(s) remain in the inning", details));
        }
        return List.of();
    }
}
