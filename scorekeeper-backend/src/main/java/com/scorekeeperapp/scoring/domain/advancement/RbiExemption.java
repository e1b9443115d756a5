package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

/**
 * A play on which runs may score without all of them being credited as RBIs.
 *
 * @param result                 the result the exemption applies to, or null for any result
 * @param requiresFieldingError  whether the exemption only applies when a fielding error occurred
 */
public record RbiExemption(BattingResult result, boolean requiresFieldingError) {

    public static RbiExemption always(BattingResult result) {
        return new RbiExemption(result, false);
    }

    public static RbiExemption anyResultOnFieldingError() {
        return new RbiExemption(null, true);
    }

    public boolean matches(BattingResult played, boolean errorOccurred) {
        if (result != null && result != played) return false;
        return !requiresFieldingError || errorOccurred;
    }
}
