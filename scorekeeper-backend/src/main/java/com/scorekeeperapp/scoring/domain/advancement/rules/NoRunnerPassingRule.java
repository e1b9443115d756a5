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
 * A runner who started behind another may not finish level with or ahead of him,
 * unless the leading runner scored or was put out on the play.
 */
public class NoRunnerPassingRule implements PlayRule {

    @Override
    public RuleId id() {
        return RuleId.NO_RUNNER_PASSING;
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        List<Map.Entry<String, Integer>> ordered = new ArrayList<>(scenario.participants().entrySet());
        ordered.sort(Map.Entry.comparingByValue());

        List<RuleViolation> violations = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            String trailing = ordered.get(i).getKey();
            int trailingFinish = scenario.finishOf(trailing);
            if (trailingFinish == PlayScenario.PUT_OUT) continue;

            for (int j = i + 1; j < ordered.size(); j++) {
                String leading = ordered.get(j).getKey();
                int leadingFinish = scenario.finishOf(leading);
                if (leadingFinish == PlayScenario.PUT_OUT || leadingFinish == Base.HOME) continue;

                if (trailingFinish >= leadingFinish) {
                    violations.add(new RuleViolation(id(),
                            "Runner " + trailing + " cannot pass runner " + leading,
                            Map.of("trailingRunner", trailing, "leadingRunner", leading)));
                }
            }
        }
        return violations;
    }
}
