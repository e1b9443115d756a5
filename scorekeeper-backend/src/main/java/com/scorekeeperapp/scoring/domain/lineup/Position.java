package com.scorekeeperapp.scoring.domain.lineup;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

public enum Position {
    PITCHER("P", true),
    CATCHER("C", true),
    FIRST_BASE("1B", true),
    SECOND_BASE("2B", true),
    THIRD_BASE("3B", true),
    SHORTSTOP("SS", true),
    LEFT_FIELD("LF", true),
    CENTER_FIELD("CF", true),
    RIGHT_FIELD("RF", true),
    SHORT_FIELDER("SF", false),
    EXTRA_PLAYER("EP", false);

    private final String abbreviation;
    private final boolean required;

    Position(String abbreviation, boolean required) {
        this.abbreviation = abbreviation;
        this.required = required;
    }

    public String abbreviation() {
        return abbreviation;
    }

    /** The nine positions every starting lineup must cover. */
    public boolean isRequired() {
        return required;
    }

    public static Set<Position> required() {
        return Arrays.stream(values())
                .filter(Position::isRequired)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Position.class)));
    }
}
