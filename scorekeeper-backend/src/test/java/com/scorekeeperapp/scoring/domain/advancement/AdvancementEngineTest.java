package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.rules.PlayRule;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AdvancementEngine")
class AdvancementEngineTest {

    private static final String BATTER = "b1";

    private final AdvancementEngine engine = new AdvancementEngine();
    private final RuleConfiguration defaults = RuleConfiguration.defaults();

    private AdvancementOutcome standard(BaserunnerState before, BattingResult result) {
        Result<AdvancementOutcome> outcome = engine.standardAdvancement(before, result, BATTER, defaults);
        assertThat(outcome.isSuccess()).as("standard advancement for %s", result).isTrue();
        return outcome.getValue();
    }

    @Nested
    @DisplayName("standard advancement")
    class Standard {

        @Test
        @DisplayName("double with a runner on first puts him on third and the batter on second")
        void doubleWithRunnerOnFirst() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", null, null), BattingResult.DOUBLE);

            assertThat(outcome.baserunnersAfter()).isEqualTo(BaserunnerState.of(null, BATTER, "p2"));
            assertThat(outcome.runsScored()).isEmpty();
            assertThat(outcome.rbis()).isZero();
            assertThat(outcome.outs()).isZero();
        }

        @Test
        @DisplayName("grand slam clears the bases with four RBIs")
        void grandSlam() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", "p3", "p4"), BattingResult.HOME_RUN);

            assertThat(outcome.baserunnersAfter().isEmpty()).isTrue();
            assertThat(outcome.runsScored()).containsExactly("p2", "p3", "p4", BATTER);
            assertThat(outcome.rbis()).isEqualTo(4);
        }

        @Test
        @DisplayName("bases-loaded walk forces in one run")
        void basesLoadedWalk() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", "p3", "p4"), BattingResult.WALK);

            assertThat(outcome.baserunnersAfter()).isEqualTo(BaserunnerState.of(BATTER, "p2", "p3"));
            assertThat(outcome.runsScored()).containsExactly("p4");
            assertThat(outcome.rbis()).isEqualTo(1);
        }

        @Test
        @DisplayName("walk leaves an unforced runner where he is")
        void walkWithUnforcedRunner() {
            AdvancementOutcome outcome = standard(BaserunnerState.of(null, "p3", null), BattingResult.WALK);

            assertThat(outcome.baserunnersAfter()).isEqualTo(BaserunnerState.of(BATTER, "p3", null));
        }

        @Test
        @DisplayName("sacrifice fly scores the runner from third and retires the batter")
        void sacrificeFly() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", null, "p4"), BattingResult.SACRIFICE_FLY);

            assertThat(outcome.baserunnersAfter()).isEqualTo(BaserunnerState.of("p2", null, null));
            assertThat(outcome.runsScored()).containsExactly("p4");
            assertThat(outcome.rbis()).isEqualTo(1);
            assertThat(outcome.outs()).isEqualTo(1);
        }

        @Test
        @DisplayName("sacrifice fly without a runner on third cannot happen")
        void sacrificeFlyNeedsThird() {
            Result<AdvancementOutcome> outcome = engine.standardAdvancement(BaserunnerState.of("p2", null, null),
                    BattingResult.SACRIFICE_FLY, BATTER, defaults);

            assertThat(outcome.isFailure()).isTrue();
            assertThat(outcome.getError().code()).isEqualTo(ErrorCode.OUTCOME_NOT_APPLICABLE);
            assertThat(outcome.getError().message()).isEqualTo("A sacrifice fly requires a runner on third");
        }

        @Test
        @DisplayName("run scoring on a reached-on-error play earns no RBI")
        void reachedOnErrorEarnsNoRbi() {
            AdvancementOutcome outcome = standard(BaserunnerState.of(null, null, "p4"), BattingResult.ERROR);

            assertThat(outcome.runsScored()).containsExactly("p4");
            assertThat(outcome.rbis()).isZero();
        }

        @Test
        @DisplayName("double play retires the batter and the runner from first")
        void doublePlay() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", null, null), BattingResult.DOUBLE_PLAY);

            assertThat(outcome.baserunnersAfter().isEmpty()).isTrue();
            assertThat(outcome.outs()).isEqualTo(2);
        }

        @Test
        @DisplayName("fielder's choice retires the runner from first and puts the batter on")
        void fieldersChoice() {
            AdvancementOutcome outcome = standard(BaserunnerState.of("p2", null, null), BattingResult.FIELDERS_CHOICE);

            assertThat(outcome.baserunnersAfter()).isEqualTo(BaserunnerState.of(BATTER, null, null));
            assertThat(outcome.outs()).isEqualTo(1);
        }

        @Test
        @DisplayName("a batter already on base is inconsistent")
        void batterAlreadyOnBase() {
            Result<AdvancementOutcome> outcome = engine.standardAdvancement(BaserunnerState.of(BATTER, null, null),
                    BattingResult.SINGLE, BATTER, defaults);

            assertThat(outcome.getError().code()).isEqualTo(ErrorCode.INCONSISTENT_RUNNERS);
        }
    }

    @Nested
    @DisplayName("valid outcome sets")
    class ValidOutcomes {

        @Test
        @DisplayName("aggressive running lets the runner from first score on a double")
        void aggressiveDouble() {
            Set<AdvancementOutcome> outcomes = engine.validOutcomes(BaserunnerState.of("p2", null, null),
                    BattingResult.DOUBLE, BATTER, OutcomeParameters.aggressive(), defaults);

            assertThat(outcomes).contains(
                    new AdvancementOutcome(BaserunnerState.of(null, BATTER, "p2"), List.of(), 0, 0),
                    new AdvancementOutcome(BaserunnerState.of(null, BATTER, null), List.of("p2"), 1, 0));
        }

        @Test
        @DisplayName("the standard outcome is listed first")
        void standardFirst() {
            BaserunnerState before = BaserunnerState.of(null, "p3", null);
            Set<AdvancementOutcome> outcomes = engine.validOutcomes(before, BattingResult.SINGLE, BATTER,
                    OutcomeParameters.conservative(), defaults);

            assertThat(outcomes.iterator().next()).isEqualTo(standard(before, BattingResult.SINGLE));
            assertThat(outcomes).hasSizeGreaterThan(1);
        }

        @Test
        @DisplayName("a running error can cost the runner from first on a single")
        void runningErrorOnSingle() {
            Set<AdvancementOutcome> outcomes = engine.validOutcomes(BaserunnerState.of("p2", null, null),
                    BattingResult.SINGLE, BATTER, OutcomeParameters.runningError(), defaults);

            assertThat(outcomes).contains(
                    new AdvancementOutcome(BaserunnerState.of(BATTER, null, null), List.of(), 0, 1));
        }

        @Test
        @DisplayName("impossible plays have no outcomes")
        void impossiblePlay() {
            assertThat(engine.validOutcomes(BaserunnerState.empty(), BattingResult.DOUBLE_PLAY, BATTER,
                    OutcomeParameters.standard(), defaults)).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("the standard play is valid and comes with no suggestions")
        void standardPlayValid() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of(null, null, "p4"), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of(BATTER, null, null), List.of("p4"), 1, 0);

            RuleValidation validation = engine.validate(scenario, defaults);

            assertThat(validation.isValid()).isTrue();
            assertThat(validation.suggestions()).isEmpty();
        }

        @Test
        @DisplayName("an invalid play reports the violation and suggests permitted outcomes")
        void invalidPlaySuggests() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of(null, null, "p4"), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of(BATTER, null, null), List.of("p4"), 0, 0);

            RuleValidation validation = engine.validate(scenario, defaults);

            assertThat(validation.isValid()).isFalse();
            assertThat(validation.firstViolation().orElseThrow().rule()).isEqualTo(RuleId.RBI_BOUND);
            assertThat(validation.suggestions()).contains(standard(BaserunnerState.of(null, null, "p4"), BattingResult.SINGLE));
        }

        @Test
        @DisplayName("error attribution can be switched off")
        void errorAttributionToggle() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of(null, "p3", null), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.fieldingError(), BaserunnerState.of(BATTER, null, null),
                    List.of("p3"), 1, 0);

            RuleValidation enforced = engine.validate(scenario, defaults);
            RuleValidation relaxed = engine.validate(scenario, defaults.toBuilder().errorAttribution(false).build());

            assertThat(enforced.violations()).extracting(RuleViolation::rule).containsExactly(RuleId.ERROR_ATTRIBUTION);
            assertThat(relaxed.isValid()).isTrue();
        }

        @Test
        @DisplayName("outs accounting catches a runner who vanished without a running error")
        void outsAccountingToggle() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of("p2", null, null), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of(BATTER, null, null), List.of(), 0, 0);

            assertThat(engine.validate(scenario, defaults).violations())
                    .extracting(RuleViolation::rule).containsExactly(RuleId.OUTS_ACCOUNTING);
            assertThat(engine.validate(scenario, defaults.toBuilder().outsAccounting(false).build()).isValid()).isTrue();
        }

        @Test
        @DisplayName("the outcome matrix is only enforced when switched on")
        void outcomeMatrixToggle() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of("p2", null, null), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of(BATTER, null, null), List.of("p2"), 1, 0);

            assertThat(engine.validate(scenario, defaults).isValid()).isTrue();
            assertThat(engine.validate(scenario, defaults.toBuilder().enforceOutcomeMatrix(true).build()).violations())
                    .extracting(RuleViolation::rule).containsExactly(RuleId.OUTCOME_MATRIX);
        }

        @Test
        @DisplayName("disabled rules never hide non-negotiable ones")
        void nonNegotiableAlwaysRun() {
            RuleConfiguration everythingOff = new RuleConfiguration(false, false, false, false, List.of());
            PlayScenario scenario = new PlayScenario(BaserunnerState.of("p2", null, null), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of("p2", BATTER, null), List.of(), 0, 0);

            assertThat(engine.validate(scenario, everythingOff).violations())
                    .extracting(RuleViolation::rule).containsExactly(RuleId.NO_RUNNER_PASSING);
        }

        @Test
        @DisplayName("a double play with two outs already is too many outs")
        void tooManyOuts() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of("p2", null, null), BattingResult.DOUBLE_PLAY,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.empty(), List.of(), 0, 2);

            assertThat(engine.validate(scenario, defaults).violations())
                    .extracting(RuleViolation::rule).contains(RuleId.MAX_OUTS_PER_PLAY);
        }

        @Test
        @DisplayName("validation is repeatable")
        void repeatable() {
            PlayScenario scenario = new PlayScenario(BaserunnerState.of("p2", null, null), BattingResult.SINGLE,
                    BATTER, OutcomeParameters.standard(), BaserunnerState.of(BATTER, null, null), List.of(), 0, 0);

            assertThat(engine.validate(scenario, defaults)).isEqualTo(engine.validate(scenario, defaults));
        }
    }

    @Test
    @DisplayName("non-negotiable rules are registered ahead of configurable ones")
    void ruleOrder() {
        assertThat(engine.rules()).extracting(PlayRule::id)
                .containsExactly(RuleId.RUNNER_CONSISTENCY, RuleId.NO_RUNNER_PASSING, RuleId.RBI_BOUND,
                        RuleId.MAX_OUTS_PER_PLAY, RuleId.ERROR_ATTRIBUTION, RuleId.OUTS_ACCOUNTING,
                        RuleId.OUTCOME_MATRIX);
    }
}
