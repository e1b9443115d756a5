package com.scorekeeperapp.scoring.domain.bases;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which bases are occupied, independent of who occupies them.
 */
public enum BaseShape {
    EMPTY,
    FIRST,
    SECOND,
    THIRD,
    FIRST_SECOND,
    FIRST_THIRD,
    SECOND_THIRD,
    LOADED;

    public static BaseShape of(boolean first, boolean second, boolean third) {
        if (first && second && third) return LOADED;
        if (first && second) return FIRST_SECOND;
        if (first && third) return FIRST_THIRD;
        if (second && third) return SECOND_THIRD;
        if (first) return FIRST;
        if (second) return SECOND;
        if (third) return THIRD;
        return EMPTY;
    }

    public Set<Base> occupied() {
        return switch (this) {
            case EMPTY -> EnumSet.noneOf(Base.class);
            case FIRST -> EnumSet.of(Base.FIRST);
            case SECOND -> EnumSet.of(Base.SECOND);
            case THIRD -> EnumSet.of(Base.THIRD);
            case FIRST_SECOND -> EnumSet.of(Base.FIRST, Base.SECOND);
            case FIRST_THIRD -> EnumSet.of(Base.FIRST, Base.THIRD);
            case SECOND_THIRD -> EnumSet.of(Base.SECOND, Base.THIRD);
            case LOADED -> EnumSet.allOf(Base.class);
        };
    }

    /**
     * Runners that must advance when the batter is awarded first base.
     * A runner is forced when every base behind him is occupied.
     */
    public Set<Base> forced() {
        return switch (this) {
            case EMPTY, SECOND, THIRD, SECOND_THIRD -> EnumSet.noneOf(Base.class);
            case FIRST, FIRST_THIRD -> EnumSet.of(Base.FIRST);
            case FIRST_SECOND -> EnumSet.of(Base.FIRST, Base.SECOND);
            case LOADED -> EnumSet.allOf(Base.class);
        };
    }

    public boolean isOccupied(Base base) {
        return occupied().contains(base);
    }

    public int runnerCount() {
        return occupied().size();
    }

    /** Highest occupied base, or null when empty. */
    public Base leadBase() {
        return switch (this) {
            case EMPTY -> null;
            case FIRST -> Base.FIRST;
            case SECOND, FIRST_SECOND -> Base.SECOND;
            case THIRD, FIRST_THIRD, SECOND_THIRD, LOADED -> Base.THIRD;
        };
    }
}
