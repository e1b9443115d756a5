package com.scorekeeperapp.scoring.domain.bases;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BaserunnerState")
class BaserunnerStateTest {

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("empty() has nobody on base")
        void emptyHasNoRunners() {
            BaserunnerState state = BaserunnerState.empty();

            assertThat(state.isEmpty()).isTrue();
            assertThat(state.runnerCount()).isZero();
            assertThat(state.shape()).isEqualTo(BaseShape.EMPTY);
            for (Base base : Base.values()) {
                assertThat(state.isOccupied(base)).isFalse();
                assertThat(state.occupant(base)).isEmpty();
            }
        }

        @Test
        @DisplayName("blank ids mean an empty base")
        void blankIdsAreEmptyBases() {
            BaserunnerState state = BaserunnerState.of(" ", null, "p4");

            assertThat(state.isOccupied(Base.FIRST)).isFalse();
            assertThat(state.occupant(Base.THIRD)).contains("p4");
            assertThat(state.shape()).isEqualTo(BaseShape.THIRD);
        }

        @Test
        @DisplayName("one player on two bases is rejected")
        void duplicatePlayerRejected() {
            assertThatThrownBy(() -> BaserunnerState.of("p2", "p2", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("A player cannot occupy more than one base");
        }

        @Test
        @DisplayName("a map with no occupants is the empty state")
        void emptyMapIsEmptyState() {
            assertThat(BaserunnerState.of(new EnumMap<>(Base.class))).isSameAs(BaserunnerState.EMPTY);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("loaded bases report every runner by base")
        void loadedBases() {
            BaserunnerState state = BaserunnerState.of("p2", "p3", "p4");

            assertThat(state.isLoaded()).isTrue();
            assertThat(state.runnerCount()).isEqualTo(3);
            assertThat(state.baseOf("p3")).contains(Base.SECOND);
            assertThat(state.contains("p9")).isFalse();
            assertThat(state.runners()).containsExactly(
                    Map.entry(Base.FIRST, "p2"), Map.entry(Base.SECOND, "p3"), Map.entry(Base.THIRD, "p4"));
        }

        @Test
        @DisplayName("with() returns a new value and leaves the original alone")
        void withIsImmutable() {
            BaserunnerState before = BaserunnerState.of("p2", null, null);

            BaserunnerState after = before.with(Base.THIRD, "p5");

            assertThat(before.isOccupied(Base.THIRD)).isFalse();
            assertThat(after.occupant(Base.THIRD)).contains("p5");
            assertThat(after.shape()).isEqualTo(BaseShape.FIRST_THIRD);
        }

        @Test
        @DisplayName("states with the same occupants are equal")
        void valueEquality() {
            Map<Base, String> occupants = new EnumMap<>(Base.class);
            occupants.put(Base.SECOND, "p3");

            assertThat(BaserunnerState.of(occupants)).isEqualTo(BaserunnerState.of(null, "p3", null));
            assertThat(BaserunnerState.of(occupants).hashCode())
                    .isEqualTo(BaserunnerState.of(null, "p3", null).hashCode());
        }
    }

    @Test
    @DisplayName("shape covers all eight occupancy combinations")
    void shapesAreExhaustive() {
        assertThat(BaseShape.of(true, false, true)).isEqualTo(BaseShape.FIRST_THIRD);
        assertThat(BaseShape.of(true, true, true)).isEqualTo(BaseShape.LOADED);
        assertThat(BaseShape.values()).hasSize(8);
        assertThat(BaseShape.SECOND_THIRD.leadBase()).isEqualTo(Base.THIRD);
        assertThat(BaseShape.FIRST_THIRD.forced()).containsExactly(Base.FIRST);
    }
}
