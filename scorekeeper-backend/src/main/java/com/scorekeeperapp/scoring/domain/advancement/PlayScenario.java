package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.bases.Base;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A proposed play submitted for validation.
 *
 * @param outsBeforePlay outs already recorded in the half-inning when the play began
 */
public record PlayScenario(
        BaserunnerState baserunnersBefore,
        BattingResult result,
        String batterId,
        OutcomeParameters parameters,
        BaserunnerState baserunnersAfter,
        List<String> runsScored,
        int rbis,
        int outsBeforePlay
) {

    /** Finish marker for a participant who is neither on base nor among the scorers. */
    public static final int PUT_OUT = 0;

    public PlayScenario {
        if (result == null) throw new IllegalArgumentException("result is required");
        if (batterId == null || batterId.isBlank()) throw new IllegalArgumentException("batterId is required");
        if (outsBeforePlay < 0 || outsBeforePlay > 2) throw new IllegalArgumentException("outsBeforePlay must be 0..2");
        if (baserunnersBefore == null) baserunnersBefore = BaserunnerState.empty();
        if (baserunnersAfter == null) baserunnersAfter = BaserunnerState.empty();
        if (parameters == null) parameters = OutcomeParameters.standard();
        runsScored = (runsScored == null) ? List.of() : List.copyOf(runsScored);
    }

    /** Runners on base at the start of the play plus the batter, mapped to their starting base (batter = 0). */
    public Map<String, Integer> participants() {
        Map<String, Integer> participants = new LinkedHashMap<>();
        baserunnersBefore.runners().forEach((base, id) -> participants.put(id, base.number()));
        participants.putIfAbsent(batterId, 0);
        return participants;
    }

    /** Where a participant finished: a base number, {@link Base#HOME}, or {@link #PUT_OUT}. */
    public int finishOf(String playerId) {
        Optional<Base> base = baserunnersAfter.baseOf(playerId);
        if (base.isPresent()) return base.get().number();
        return runsScored.contains(playerId) ? Base.HOME : PUT_OUT;
    }

    public List<String> distinctScorers() {
        return new ArrayList<>(new LinkedHashSet<>(runsScored));
    }

    /** Scorers ordered the way outcomes list them: by starting base, batter last. */
    public List<String> orderedScorers() {
        Map<String, Integer> participants = participants();
        List<String> scorers = distinctScorers();
        scorers.sort(Comparator.comparingInt(id -> {
            Integer start = participants.get(id);
            if (start == null) return 5;
            return start == 0 ? Base.HOME : start;
        }));
        return scorers;
    }

    public int outsOnPlay() {
        return AdvancementCalculator.outsOnPlay(baserunnersBefore, baserunnersAfter, runsScored);
    }

    public AdvancementOutcome toOutcome() {
        return new AdvancementOutcome(baserunnersAfter, orderedScorers(), Math.max(0, rbis), Math.max(0, outsOnPlay()));
    }
}
