package com.scorekeeperapp.scoring.domain.lineup;

public record LineupSlot(int battingOrder, String playerId, Position position) {

    public LineupSlot {
        if (battingOrder < 1 || battingOrder > Lineup.SIZE) {
            throw new IllegalArgumentException("battingOrder must be 1.." + Lineup.SIZE);
        }
        if (playerId == null || playerId.isBlank()) throw new IllegalArgumentException("playerId is required");
        if (position == null) throw new IllegalArgumentException("position is required");
    }

    public LineupSlot withPlayer(String replacementId) {
        return new LineupSlot(battingOrder, replacementId, position);
    }
}
