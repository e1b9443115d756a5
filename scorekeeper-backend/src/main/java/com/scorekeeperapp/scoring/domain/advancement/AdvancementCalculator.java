package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.common.result.ScoringError;
import com.scorekeeperapp.scoring.domain.bases.Base;
import com.scorekeeperapp.scoring.domain.bases.BaseShape;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns enumerated move plans into concrete outcomes for the players on base.
 */
public class AdvancementCalculator {

    public Result<AdvancementOutcome> standardAdvancement(BaserunnerState runners, BattingResult result,
                                                          String batterId, RuleConfiguration configuration) {
        BaserunnerState before = (runners == null) ? BaserunnerState.empty() : runners;
        Optional<ScoringError> problem = checkPlay(before, result, batterId);
        if (problem.isPresent()) return Result.failure(problem.get());

        BaseShape shape = before.shape();
        Optional<MovePlan> plan = OutcomeMatrix.canonical(shape, result);
        if (plan.isEmpty()) {
            return Result.failure(ErrorCode.OUTCOME_NOT_APPLICABLE, notApplicableMessage(result),
                    Map.of("result", result.code(), "bases", shape.name()));
        }
        return Result.success(bind(plan.get(), before, batterId, result, OutcomeParameters.standard(), configuration));
    }

    /**
     * All outcomes the rules permit; the standard outcome comes first when it is part of the set.
     * Empty when the result cannot occur with these runners.
     */
    public Set<AdvancementOutcome> validOutcomes(BaserunnerState runners, BattingResult result, String batterId,
                                                 OutcomeParameters parameters, RuleConfiguration configuration) {
        BaserunnerState before = (runners == null) ? BaserunnerState.empty() : runners;
        if (checkPlay(before, result, batterId).isPresent()) return Collections.emptySet();
        OutcomeParameters params = (parameters == null) ? OutcomeParameters.standard() : parameters;

        BaseShape shape = before.shape();
        Set<MovePlan> plans = OutcomeMatrix.plans(shape, result, params, configuration.extendedRunningErrors());
        Set<AdvancementOutcome> outcomes = new LinkedHashSet<>();
        OutcomeMatrix.canonical(shape, result)
                .filter(plans::contains)
                .ifPresent(p -> outcomes.add(bind(p, before, batterId, result, params, configuration)));
        for (MovePlan plan : plans) {
            outcomes.add(bind(plan, before, batterId, result, params, configuration));
        }
        return Collections.unmodifiableSet(outcomes);
    }

    /**
     * Outs recorded on a play, derived by conservation: everybody who started the play
     * (runners plus batter) either is still on base, scored, or was put out.
     */
    public static int outsOnPlay(BaserunnerState before, BaserunnerState after, List<String> runsScored) {
        int scored = (runsScored == null) ? 0 : (int) runsScored.stream().distinct().count();
        return before.runnerCount() + 1 - after.runnerCount() - scored;
    }

    private AdvancementOutcome bind(MovePlan plan, BaserunnerState before, String batterId, BattingResult result,
                                    OutcomeParameters params, RuleConfiguration configuration) {
        Map<Base, String> after = new EnumMap<>(Base.class);
        List<String> scored = new ArrayList<>();
        for (int start : new int[]{1, 2, 3, 0}) {
            int finish = plan.finish(start);
            if (finish == MovePlan.ABSENT || finish == MovePlan.OUT) continue;
            String playerId = (start == 0) ? batterId : before.occupant(Base.ofNumber(start)).orElseThrow();
            if (finish == MovePlan.HOME) {
                scored.add(playerId);
            } else {
                after.put(Base.ofNumber(finish), playerId);
            }
        }
        int rbis = rbiCredit(plan, before.shape(), result, params, configuration);
        return new AdvancementOutcome(BaserunnerState.of(after), scored, rbis, plan.outs());
    }

    private int rbiCredit(MovePlan plan, BaseShape shape, BattingResult result, OutcomeParameters params,
                          RuleConfiguration configuration) {
        int scored = 0;
        for (int start = 0; start <= 3; start++) {
            if (plan.finish(start) == MovePlan.HOME) scored++;
        }
        Optional<RbiExemption> exemption = configuration.exemptionFor(result, params.errorOccurred());
        if (exemption.isEmpty()) return scored;
        if (!exemption.get().requiresFieldingError()) return 0;

        // only runs that would have scored without the error are earned
        MovePlan clean = OutcomeMatrix.canonical(shape, result).orElse(null);
        if (clean == null) return 0;
        int earned = 0;
        for (int start = 0; start <= 3; start++) {
            if (plan.finish(start) == MovePlan.HOME && clean.finish(start) == MovePlan.HOME) earned++;
        }
        return earned;
    }

    private static Optional<ScoringError> checkPlay(BaserunnerState before, BattingResult result, String batterId) {
        if (result == null) {
            return Optional.of(new ScoringError(ErrorCode.RESULT_REQUIRED, "Batting result is required"));
        }
        if (batterId == null || batterId.isBlank()) {
            return Optional.of(new ScoringError(ErrorCode.BATTER_REQUIRED, "Batter ID is required"));
        }
        if (before.contains(batterId)) {
            return Optional.of(new ScoringError(ErrorCode.INCONSISTENT_RUNNERS,
                    "Batter " + batterId + " is already on base", Map.of("batterId", batterId)));
        }
        return Optional.empty();
    }

    private static String notApplicableMessage(BattingResult result) {
        return switch (result) {
            case SACRIFICE_FLY -> "A sacrifice fly requires a runner on third";
            case FIELDERS_CHOICE -> "A fielder's choice requires at least one runner on base";
            case DOUBLE_PLAY -> "A double play requires at least one runner on base";
            default -> result.label() + " cannot occur with these runners";
        };
    }
}
