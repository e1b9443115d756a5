package com.scorekeeperapp.scoring.domain.bases;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable occupancy of first, second and third base.
 * Every transition produces a new value; a player id occupies at most one base.
 */
public final class BaserunnerState {

    public static final BaserunnerState EMPTY = new BaserunnerState(null, null, null);

    private final String first;
    private final String second;
    private final String third;

    private BaserunnerState(String first, String second, String third) {
        this.first = first;
        this.second = second;
        this.third = third;
    }

    public static BaserunnerState empty() {
        return EMPTY;
    }

    /**
     * Builds a state from up to three player ids; null or blank means the base is empty.
     *
     * @throws IllegalArgumentException when the same player occupies two bases
     */
    public static BaserunnerState of(String first, String second, String third) {
        String f = normalize(first);
        String s = normalize(second);
        String t = normalize(third);
        if ((f != null && (f.equals(s) || f.equals(t))) || (s != null && s.equals(t))) {
            throw new IllegalArgumentException("A player cannot occupy more than one base");
        }
        if (f == null && s == null && t == null) return EMPTY;
        return new BaserunnerState(f, s, t);
    }

    public static BaserunnerState of(Map<Base, String> occupants) {
        if (occupants == null || occupants.isEmpty()) return EMPTY;
        return of(occupants.get(Base.FIRST), occupants.get(Base.SECOND), occupants.get(Base.THIRD));
    }

    public boolean isOccupied(Base base) {
        return occupant(base).isPresent();
    }

    public Optional<String> occupant(Base base) {
        return Optional.ofNullable(raw(base));
    }

    public Optional<Base> baseOf(String playerId) {
        if (playerId == null) return Optional.empty();
        for (Base base : Base.values()) {
            if (playerId.equals(raw(base))) return Optional.of(base);
        }
        return Optional.empty();
    }

    public boolean contains(String playerId) {
        return baseOf(playerId).isPresent();
    }

    /** Runners keyed by base, ordered first to third. */
    public Map<Base, String> runners() {
        Map<Base, String> map = new EnumMap<>(Base.class);
        for (Base base : Base.values()) {
            String id = raw(base);
            if (id != null) map.put(base, id);
        }
        return Collections.unmodifiableMap(map);
    }

    public int runnerCount() {
        return runners().size();
    }

    public boolean isEmpty() {
        return first == null && second == null && third == null;
    }

    public boolean isLoaded() {
        return first != null && second != null && third != null;
    }

    public BaseShape shape() {
        return BaseShape.of(first != null, second != null, third != null);
    }

    public BaserunnerState with(Base base, String playerId) {
        return switch (base) {
            case FIRST -> of(playerId, second, third);
            case SECOND -> of(first, playerId, third);
            case THIRD -> of(first, second, playerId);
        };
    }

    private String raw(Base base) {
        return switch (base) {
            case FIRST -> first;
            case SECOND -> second;
            case THIRD -> third;
        };
    }

    private static String normalize(String id) {
        return (id == null || id.isBlank()) ? null : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BaserunnerState other)) return false;
        return Objects.equals(first, other.first)
                && Objects.equals(second, other.second)
                && Objects.equals(third, other.third);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, third);
    }

    @Override
    public String toString() {
        return "BaserunnerState{first=" + first + ", second=" + second + ", third=" + third + "}";
    }
}
