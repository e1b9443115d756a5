package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;
import com.scorekeeperapp.scoring.domain.bases.Base;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runners after the play and players who scored must come from the runners before plus the batter,
 * nobody both scores and stays on base, and nobody moves backwards.
 */
public class RunnerConsistencyRule implements PlayRule {

    @Override
    public RuleId id() {
        return RuleId.RUNNER_CONSISTENCY;
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        List<RuleViolation> violations = new ArrayList<>();
        String batterId = scenario.batterId();

        if (scenario.baserunnersBefore().contains(batterId)) {
            violations.add(violation("Batter " + batterId + " is already on base", Map.of("playerId", batterId)));
        }

        Map<String, Integer> participants = scenario.participants();
        for (Map.Entry<Base, String> runner : scenario.baserunnersAfter().runners().entrySet()) {
            String id = runner.getValue();
            Integer start = participants.get(id);
            if (start == null) {
                violations.add(violation("Runner " + id + " was not on base and did not bat", Map.of("playerId", id)));
            } else if (runner.getKey().number() < start) {
                violations.add(violation("Runner " + id + " cannot move back from base " + start
                                + " to base " + runner.getKey().number(),
                        Map.of("playerId", id, "from", start, "to", runner.getKey().number())));
            }
        }

        for (String id : scenario.distinctScorers()) {
            if (!participants.containsKey(id)) {
                violations.add(violation("Player " + id + " cannot score without being on base or batting",
                        Map.of("playerId", id)));
            } else if (scenario.baserunnersAfter().contains(id)) {
                violations.add(violation("Player " + id + " cannot both score and remain on base",
                        Map.of("playerId", id)));
            }
        }

        if (scenario.runsScored().size() != scenario.distinctScorers().size()) {
            violations.add(violation("A player cannot score multiple times in the same at-bat", Map.of()));
        }
        return violations;
    }

    private RuleViolation violation(String message, Map<String, Object> details) {
        return new RuleViolation(id(), message, details);
    }
}
