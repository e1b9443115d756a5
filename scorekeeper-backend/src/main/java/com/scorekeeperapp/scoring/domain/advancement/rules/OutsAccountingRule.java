package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;

import java.util.List;
import java.util.Map;

/**
 * Outs on the play must cover the result's own outs. One more is allowed for a running error.
 */
public class OutsAccountingRule implements PlayRule {

    @Override
    public RuleId id() {
        return RuleId.OUTS_ACCOUNTING;
    }

    @Override
    public boolean isEnabled(RuleConfiguration configuration) {
        return configuration.outsAccounting();
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        int outs = scenario.outsOnPlay();
        int inherent = scenario.result().outsRecorded();
        Map<String, Object> details = Map.of("outsOnPlay", outs, "expectedOuts", inherent);

        if (outs < inherent) {
            return List.of(new RuleViolation(id(),
                    scenario.result().label() + " records " + inherent + " out(s) but the play shows " + outs, details));
        }
        int extra = outs - inherent;
        if (extra > 0 && !scenario.parameters().runningErrorOccurred()) {
            return List.of(new RuleViolation(id(),
                    "Additional outs on a " + scenario.result().label() + " require a running error", details));
        }
        if (extra > 1) {
            return List.of(new RuleViolation(id(),
                    "A running error accounts for at most one additional out", details));
        }
        return List.of();
    }
}
