package com.scorekeeperapp.scoring.domain.atbat;

import com.scorekeeperapp.scoring.domain.advancement.OutcomeParameters;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A plate appearance as submitted by the scorer. Field checks happen in {@link AtBatRecorder}.
 */
public record RecordAtBatCommand(
        String gameId,
        String batterId,
        int inning,
        boolean topOfInning,
        BattingResult result,
        String description,
        int rbis,
        BaserunnerState baserunnersBefore,
        BaserunnerState baserunnersAfter,
        List<String> runsScored,
        OutcomeParameters parameters
) {

    public RecordAtBatCommand {
        if (baserunnersBefore == null) baserunnersBefore = BaserunnerState.empty();
        if (baserunnersAfter == null) baserunnersAfter = BaserunnerState.empty();
        // duplicates and blanks are kept so they can be reported
        runsScored = (runsScored == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(runsScored));
        if (parameters == null) parameters = OutcomeParameters.standard();
        if (description == null) description = "";
    }
}
