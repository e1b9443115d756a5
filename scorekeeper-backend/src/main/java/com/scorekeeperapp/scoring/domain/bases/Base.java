package com.scorekeeperapp.scoring.domain.bases;

public enum Base {
    FIRST(1),
    SECOND(2),
    THIRD(3);

    /** Home plate, used when talking about where a runner finished. */
    public static final int HOME = 4;

    private final int number;

    Base(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public static Base ofNumber(int number) {
        return switch (number) {
            case 1 -> FIRST;
            case 2 -> SECOND;
            case 3 -> THIRD;
            default -> throw new IllegalArgumentException("No base numbered " + number);
        };
    }
}
