package com.scorekeeperapp.scoring.domain.lineup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Validated starting lineup: nine slots in batting order plus the bench.
 * Built by {@link LineupValidator}; the constructor only guards against programming errors.
 */
public record Lineup(List<LineupSlot> slots, List<String> substitutes) {

    public static final int SIZE = 9;

    public Lineup {
        if (slots == null || slots.size() != SIZE) {
            throw new IllegalArgumentException("Lineup must have exactly " + SIZE + " players");
        }
        List<LineupSlot> sorted = new ArrayList<>(slots);
        sorted.sort(Comparator.comparingInt(LineupSlot::battingOrder));
        for (int i = 0; i < SIZE; i++) {
            if (sorted.get(i).battingOrder() != i + 1) {
                throw new IllegalArgumentException("Batting orders must be exactly 1 through 9");
            }
        }
        slots = List.copyOf(sorted);
        substitutes = (substitutes == null) ? List.of() : List.copyOf(substitutes);
    }

    public LineupSlot slot(int battingOrder) {
        if (battingOrder < 1 || battingOrder > SIZE) {
            throw new IllegalArgumentException("battingOrder must be 1.." + SIZE);
        }
        return slots.get(battingOrder - 1);
    }

    public Optional<LineupSlot> slotOf(String playerId) {
        return slots.stream().filter(s -> s.playerId().equals(playerId)).findFirst();
    }

    public boolean isStarter(String playerId) {
        return slotOf(playerId).isPresent();
    }

    public boolean isOnBench(String playerId) {
        return substitutes.contains(playerId);
    }

    /**
     * New lineup with the substitute batting in the given slot at the same position.
     * The replaced starter leaves the game and the substitute leaves the bench.
     */
    public Lineup substitute(int battingOrder, String substituteId) {
        if (!isOnBench(substituteId)) {
            throw new IllegalArgumentException("Player " + substituteId + " is not on the bench");
        }
        List<LineupSlot> updated = new ArrayList<>(slots);
        updated.set(battingOrder - 1, slot(battingOrder).withPlayer(substituteId));
        List<String> bench = new ArrayList<>(substitutes);
        bench.remove(substituteId);
        return new Lineup(updated, bench);
    }
}
