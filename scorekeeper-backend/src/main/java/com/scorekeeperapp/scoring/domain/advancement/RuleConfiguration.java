package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import lombok.Builder;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Which configurable rules are active. Passed explicitly into every engine call.
 *
 * @param errorAttribution      runs caused by fielding errors are not credited as RBIs
 * @param outsAccounting        outs on a play must match the result, with one extra allowed for a running error
 * @param enforceOutcomeMatrix  a proposed advancement must be one of the enumerated outcomes
 * @param extendedRunningErrors running-error outs for every runner, not only the runner from first on a single
 * @param rbiExemptions         plays whose runs are not all RBIs; only honoured with error attribution on
 */
@Builder(toBuilder = true)
public record RuleConfiguration(
        boolean errorAttribution,
        boolean outsAccounting,
        boolean enforceOutcomeMatrix,
        boolean extendedRunningErrors,
        List<RbiExemption> rbiExemptions
) {

    public RuleConfiguration {
        rbiExemptions = (rbiExemptions == null) ? List.of() : List.copyOf(rbiExemptions);
    }

    public static RuleConfiguration defaults() {
        return new RuleConfiguration(true, true, false, true, defaultRbiExemptions());
    }

    public static List<RbiExemption> defaultRbiExemptions() {
        return List.of(
                RbiExemption.always(BattingResult.ERROR),
                RbiExemption.always(BattingResult.DOUBLE_PLAY),
                RbiExemption.anyResultOnFieldingError()
        );
    }

    public boolean isRbiExempt(BattingResult result, boolean errorOccurred) {
        return exemptionFor(result, errorOccurred).isPresent();
    }

    /**
     * The exemption covering this play, preferring one that applies without a fielding error.
     * Always empty while error attribution is off.
     */
    public Optional<RbiExemption> exemptionFor(BattingResult result, boolean errorOccurred) {
        if (!errorAttribution) return Optional.empty();
        return rbiExemptions.stream()
                .filter(e -> e.matches(result, errorOccurred))
                .min(Comparator.comparing(RbiExemption::requiresFieldingError));
    }
}
