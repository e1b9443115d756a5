package com.scorekeeperapp.scoring.domain.atbat;

import com.scorekeeperapp.scoring.domain.advancement.OutcomeParameters;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.domain.lineup.Lineup;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;

/**
 * Immutable record of one plate appearance. Corrections are new records, never edits.
 */
public record AtBat(
        String id,
        String gameId,
        String inningId,
        String batterId,
        int battingPosition,
        BattingResult result,
        String description,
        int rbis,
        List<String> runsScored,
        BaserunnerState baserunnersBefore,
        BaserunnerState baserunnersAfter,
        int outsOnPlay,
        OutcomeParameters parameters,
        Instant timestamp
) {

    public AtBat {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (gameId == null || gameId.isBlank()) throw new IllegalArgumentException("gameId is required");
        if (batterId == null || batterId.isBlank()) throw new IllegalArgumentException("batterId is required");
        if (result == null) throw new IllegalArgumentException("result is required");
        if (battingPosition < 1 || battingPosition > Lineup.SIZE) {
            throw new IllegalArgumentException("battingPosition must be 1.." + Lineup.SIZE);
        }
        if (rbis < 0 || rbis > BattingResult.MAX_RBIS_PER_PLAY) {
            throw new IllegalArgumentException("rbis must be 0.." + BattingResult.MAX_RBIS_PER_PLAY);
        }
        if (result.forbidsRbi() && rbis > 0) {
            throw new IllegalArgumentException(result.label() + " cannot carry RBIs");
        }
        description = (description == null) ? "" : description;
        if (description.length() > AtBatRecorder.MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Description cannot exceed 500 characters");
        }
        runsScored = (runsScored == null) ? List.of() : List.copyOf(runsScored);
        if (new HashSet<>(runsScored).size() != runsScored.size()) {
            throw new IllegalArgumentException("A player cannot score multiple times in the same at-bat");
        }
        if (outsOnPlay < 0 || outsOnPlay > 3) throw new IllegalArgumentException("outsOnPlay must be 0..3");
        if (baserunnersBefore == null) baserunnersBefore = BaserunnerState.empty();
        if (baserunnersAfter == null) baserunnersAfter = BaserunnerState.empty();
        if (parameters == null) parameters = OutcomeParameters.standard();
        if (timestamp == null) throw new IllegalArgumentException("timestamp is required");
    }

    public int runs() {
        return runsScored.size();
    }
}
