package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.rules.ErrorAttributionRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.MaxOutsPerPlayRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.NoRunnerPassingRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.OutcomeMatrixRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.OutsAccountingRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.PlayRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.RbiBoundRule;
import com.scorekeeperapp.scoring.domain.advancement.rules.RunnerConsistencyRule;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Computes and validates baserunner advancement.
 *
 * Validation never throws for a rule breach and never corrects a submission:
 * - non-negotiable rules run first, always
 * - configurable rules run only when enabled in the given {@link RuleConfiguration}
 * - an invalid play comes back with every violation and the outcomes that would have been permitted
 */
public class AdvancementEngine {

    private final AdvancementCalculator calculator;
    private final List<PlayRule> nonNegotiableRules;
    private final List<PlayRule> configurableRules;

    public AdvancementEngine() {
        this(new AdvancementCalculator());
    }

    public AdvancementEngine(AdvancementCalculator calculator) {
        this.calculator = calculator;
        this.nonNegotiableRules = List.of(
                new RunnerConsistencyRule(),
                new NoRunnerPassingRule(),
                new RbiBoundRule(),
                new MaxOutsPerPlayRule()
        );
        this.configurableRules = List.of(
                new ErrorAttributionRule(calculator),
                new OutsAccountingRule(),
                new OutcomeMatrixRule(calculator)
        );
    }

    public Result<AdvancementOutcome> standardAdvancement(BaserunnerState before, BattingResult result,
                                                          String batterId, RuleConfiguration configuration) {
        return calculator.standardAdvancement(before, result, batterId, configuration);
    }

    public Set<AdvancementOutcome> validOutcomes(BaserunnerState before, BattingResult result, String batterId,
                                                 OutcomeParameters parameters, RuleConfiguration configuration) {
        return calculator.validOutcomes(before, result, batterId, parameters, configuration);
    }

    public RuleValidation validate(PlayScenario scenario, RuleConfiguration configuration) {
        List<RuleViolation> violations = new ArrayList<>();
        for (PlayRule rule : nonNegotiableRules) {
            violations.addAll(rule.evaluate(scenario, configuration));
        }
        for (PlayRule rule : configurableRules) {
            if (rule.isEnabled(configuration)) {
                violations.addAll(rule.evaluate(scenario, configuration));
            }
        }
        if (violations.isEmpty()) return new RuleValidation(List.of(), List.of());

        List<AdvancementOutcome> suggestions = new ArrayList<>(validOutcomes(scenario.baserunnersBefore(),
                scenario.result(), scenario.batterId(), scenario.parameters(), configuration));
        return new RuleValidation(violations, suggestions);
    }

    public List<PlayRule> rules() {
        List<PlayRule> all = new ArrayList<>(nonNegotiableRules);
        all.addAll(configurableRules);
        return List.copyOf(all);
    }
}
