package com.scorekeeperapp.scoring.domain.lineup;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.support.TestGames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LineupValidator")
class LineupValidatorTest {

    private static final Predicate<String> REGISTERED = id -> !id.startsWith("ghost");

    private final LineupValidator validator = new LineupValidator();

    private Result<Lineup> validate(List<LineupEntry> entries, List<String> substitutes) {
        return validator.validate(new SetupLineupCommand("g1", entries, substitutes), REGISTERED);
    }

    private static List<LineupEntry> replace(int index, LineupEntry entry) {
        List<LineupEntry> entries = new ArrayList<>(TestGames.entries());
        entries.set(index, entry);
        return entries;
    }

    @Test
    @DisplayName("a full lineup with a bench is accepted in batting order")
    void validLineup() {
        List<LineupEntry> shuffled = new ArrayList<>(TestGames.entries());
        Collections.reverse(shuffled);

        Result<Lineup> result = validate(shuffled, List.of("p10", "p11"));

        assertThat(result.isSuccess()).isTrue();
        Lineup lineup = result.getValue();
        assertThat(lineup.slots()).extracting(LineupSlot::battingOrder).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(lineup.slot(1).playerId()).isEqualTo("p1");
        assertThat(lineup.substitutes()).containsExactly("p10", "p11");
    }

    @Nested
    @DisplayName("lineup shape")
    class Shape {

        @Test
        @DisplayName("eight players is too few")
        void eightPlayers() {
            Result<Lineup> result = validate(TestGames.entries().subList(0, 8), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.LINEUP_SIZE);
            assertThat(result.getError().message()).isEqualTo("Lineup must have exactly 9 players");
        }

        @Test
        @DisplayName("ten players is too many")
        void tenPlayers() {
            List<LineupEntry> entries = new ArrayList<>(TestGames.entries());
            entries.add(new LineupEntry(10, "p10", Position.EXTRA_PLAYER));

            assertThat(validate(entries, List.of()).getError().code()).isEqualTo(ErrorCode.LINEUP_SIZE);
        }

        @Test
        @DisplayName("batting orders must run 1 through 9")
        void battingOrderGap() {
            Result<Lineup> result = validate(replace(8, new LineupEntry(10, "p9", Position.RIGHT_FIELD)), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.BATTING_ORDER_INVALID);
            assertThat(result.getError().message()).isEqualTo("Batting orders must be exactly 1 through 9");
        }

        @Test
        @DisplayName("a missing batting order is invalid")
        void nullBattingOrder() {
            assertThat(validate(replace(0, new LineupEntry(null, "p1", Position.PITCHER)), List.of())
                    .getError().code()).isEqualTo(ErrorCode.BATTING_ORDER_INVALID);
        }
    }

    @Nested
    @DisplayName("players and positions")
    class PlayersAndPositions {

        @Test
        @DisplayName("two pitchers is rejected")
        void twoPitchers() {
            Result<Lineup> result = validate(replace(8, new LineupEntry(9, "p9", Position.PITCHER)), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.DUPLICATE_POSITION);
            assertThat(result.getError().message()).isEqualTo("Each position can only be assigned to one player");
        }

        @Test
        @DisplayName("the same player twice is rejected")
        void duplicatePlayer() {
            Result<Lineup> result = validate(replace(8, new LineupEntry(9, "p1", Position.RIGHT_FIELD)), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.DUPLICATE_LINEUP_PLAYER);
        }

        @Test
        @DisplayName("an extra player cannot stand in for a required position")
        void requiredPositionMissing() {
            Result<Lineup> result = validate(replace(8, new LineupEntry(9, "p9", Position.EXTRA_PLAYER)), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.POSITIONS_UNFILLED);
            assertThat(result.getError().details()).containsEntry("missingPositions", List.of("RIGHT_FIELD"));
        }

        @Test
        @DisplayName("unregistered players are not found")
        void unknownPlayer() {
            Result<Lineup> result = validate(replace(3, new LineupEntry(4, "ghost-4", Position.SECOND_BASE)), List.of());

            assertThat(result.getError().code()).isEqualTo(ErrorCode.PLAYER_NOT_FOUND);
            assertThat(result.getError().message()).isEqualTo("Player ghost-4 not found");
        }

        @Test
        @DisplayName("blank player id")
        void blankPlayer() {
            assertThat(validate(replace(3, new LineupEntry(4, " ", Position.SECOND_BASE)), List.of())
                    .getError().code()).isEqualTo(ErrorCode.PLAYER_REQUIRED);
        }
    }

    @Nested
    @DisplayName("substitutes")
    class Substitutes {

        @Test
        @DisplayName("a starter on the bench is rejected, and accepted once removed")
        void starterOnBench() {
            Result<Lineup> rejected = validate(TestGames.entries(), List.of("p10", "p3"));
            Result<Lineup> accepted = validate(TestGames.entries(), List.of("p10"));

            assertThat(rejected.getError().code()).isEqualTo(ErrorCode.SUBSTITUTE_IN_LINEUP);
            assertThat(rejected.getError().message()).isEqualTo("Substitute p3 is already in the starting lineup");
            assertThat(accepted.isSuccess()).isTrue();
            assertThat(accepted.getValue().substitutes()).containsExactly("p10");
        }

        @Test
        @DisplayName("the same substitute twice is rejected")
        void duplicateSubstitute() {
            assertThat(validate(TestGames.entries(), List.of("p10", "p10")).getError().code())
                    .isEqualTo(ErrorCode.DUPLICATE_SUBSTITUTE);
        }

        @Test
        @DisplayName("unregistered substitutes are not found")
        void unknownSubstitute() {
            assertThat(validate(TestGames.entries(), List.of("ghost-10")).getError().message())
                    .isEqualTo("Substitute player ghost-10 not found");
        }
    }

    @Test
    @DisplayName("validating the same lineup twice gives the same lineup")
    void repeatable() {
        assertThat(validate(TestGames.entries(), List.of("p10")).getValue())
                .isEqualTo(validate(TestGames.entries(), List.of("p10")).getValue());
    }
}
