package com.scorekeeperapp.scoring.domain.advancement.rules;

import com.scorekeeperapp.scoring.domain.advancement.AdvancementCalculator;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementOutcome;
import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleId;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class OutcomeMatrixRule implements PlayRule {

    private final AdvancementCalculator calculator;

    public OutcomeMatrixRule(AdvancementCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public RuleId id() {
        return RuleId.OUTCOME_MATRIX;
    }

    @Override
    public boolean isEnabled(RuleConfiguration configuration) {
        return configuration.enforceOutcomeMatrix();
    }

    @Override
    public List<RuleViolation> evaluate(PlayScenario scenario, RuleConfiguration configuration) {
        Set<AdvancementOutcome> permitted = calculator.validOutcomes(scenario.baserunnersBefore(), scenario.result(),
                scenario.batterId(), scenario.parameters(), configuration);
        if (permitted.contains(scenario.toOutcome())) return List.of();

        return List.of(new RuleViolation(id(),
                "This advancement is not a permitted outcome for a " + scenario.result().label(),
                Map.of("permittedOutcomes", permitted.size())));
    }
}
