package com.scorekeeperapp.scoring.domain.lineup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record SetupLineupCommand(String gameId, List<LineupEntry> entries, List<String> substitutes) {

    public SetupLineupCommand {
        // null elements survive so the validator can report them
        entries = (entries == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(entries));
        substitutes = (substitutes == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(substitutes));
    }
}
