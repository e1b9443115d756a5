package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;

import java.util.List;

/**
 * Resulting base state of a play.
 * {@code runsScored} is ordered by starting base (first, second, third) with the batter last.
 */
public record AdvancementOutcome(BaserunnerState baserunnersAfter, List<String> runsScored, int rbis, int outs) {

    public AdvancementOutcome {
        if (baserunnersAfter == null) baserunnersAfter = BaserunnerState.empty();
        runsScored = (runsScored == null) ? List.of() : List.copyOf(runsScored);
        if (rbis < 0) throw new IllegalArgumentException("rbis must be >= 0");
        if (outs < 0) throw new IllegalArgumentException("outs must be >= 0");
    }

    public int runs() {
        return runsScored.size();
    }
}
