package com.scorekeeperapp.scoring.domain.lineup;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Checks a proposed starting lineup and bench. Stops at the first problem.
 * Holds no state, so checking the same command twice gives the same answer.
 */
public class LineupValidator {

    private static final Set<Integer> BATTING_ORDERS = IntStream.rangeClosed(1, Lineup.SIZE)
            .boxed()
            .collect(Collectors.toUnmodifiableSet());

    public Result<Lineup> validate(SetupLineupCommand command, Predicate<String> playerExists) {
        List<LineupEntry> entries = command.entries();

        if (entries.size() != Lineup.SIZE) {
            return Result.failure(ErrorCode.LINEUP_SIZE, "Lineup must have exactly 9 players",
                    Map.of("size", entries.size()));
        }

        Set<Integer> orders = new HashSet<>();
        for (LineupEntry entry : entries) {
            if (entry == null || entry.battingOrder() == null) {
                return battingOrderFailure();
            }
            orders.add(entry.battingOrder());
        }
        if (!orders.equals(BATTING_ORDERS)) {
            return battingOrderFailure();
        }

        Set<String> starters = new HashSet<>();
        for (LineupEntry entry : entries) {
            if (entry.playerId() == null || entry.playerId().isBlank()) {
                return Result.failure(ErrorCode.PLAYER_REQUIRED,
                        "Player ID is required for batting order " + entry.battingOrder(),
                        Map.of("battingOrder", entry.battingOrder()));
            }
            if (!starters.add(entry.playerId())) {
                return Result.failure(ErrorCode.DUPLICATE_LINEUP_PLAYER, "Each player can only appear once in the lineup",
                        Map.of("playerId", entry.playerId()));
            }
        }

        Set<Position> positions = EnumSet.noneOf(Position.class);
        for (LineupEntry entry : entries) {
            if (entry.position() != null && !positions.add(entry.position())) {
                return Result.failure(ErrorCode.DUPLICATE_POSITION, "Each position can only be assigned to one player",
                        Map.of("position", entry.position().name()));
            }
        }
        if (!positions.containsAll(Position.required())) {
            Set<Position> missing = EnumSet.copyOf(Position.required());
            missing.removeAll(positions);
            return Result.failure(ErrorCode.POSITIONS_UNFILLED, "All required defensive positions must be filled",
                    Map.of("missingPositions", missing.stream().map(Position::name).toList()));
        }

        for (LineupEntry entry : entries) {
            if (!playerExists.test(entry.playerId())) {
                return Result.failure(ErrorCode.PLAYER_NOT_FOUND, "Player " + entry.playerId() + " not found",
                        Map.of("playerId", entry.playerId()));
            }
        }
        for (String substitute : command.substitutes()) {
            if (substitute == null || substitute.isBlank()) {
                return Result.failure(ErrorCode.PLAYER_REQUIRED, "Substitute player ID cannot be blank");
            }
            if (!playerExists.test(substitute)) {
                return Result.failure(ErrorCode.PLAYER_NOT_FOUND, "Substitute player " + substitute + " not found",
                        Map.of("playerId", substitute));
            }
        }

        for (String substitute : command.substitutes()) {
            if (starters.contains(substitute)) {
                return Result.failure(ErrorCode.SUBSTITUTE_IN_LINEUP,
                        "Substitute " + substitute + " is already in the starting lineup",
                        Map.of("playerId", substitute));
            }
        }

        Set<String> bench = new HashSet<>();
        for (String substitute : command.substitutes()) {
            if (!bench.add(substitute)) {
                return Result.failure(ErrorCode.DUPLICATE_SUBSTITUTE, "Substitute " + substitute + " appears multiple times",
                        Map.of("playerId", substitute));
            }
        }

        List<LineupSlot> slots = new ArrayList<>(Lineup.SIZE);
        for (LineupEntry entry : entries) {
            slots.add(new LineupSlot(entry.battingOrder(), entry.playerId(), entry.position()));
        }
        return Result.success(new Lineup(slots, command.substitutes()));
    }

    private static Result<Lineup> battingOrderFailure() {
        return Result.failure(ErrorCode.BATTING_ORDER_INVALID, "Batting orders must be exactly 1 through 9");
    }
}
