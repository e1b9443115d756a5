package com.scorekeeperapp.scoring.domain.outcome;

import java.util.Locale;

/**
 * Closed catalogue of plate-appearance results with their fixed rule metadata.
 */
public enum BattingResult {

    SINGLE("1B", "Single", true, false, 0, 1, false),
    DOUBLE("2B", "Double", true, false, 0, 2, false),
    TRIPLE("3B", "Triple", true, false, 0, 3, false),
    HOME_RUN("HR", "Home Run", true, false, 0, 4, false),
    WALK("BB", "Walk", false, false, 0, 1, false),
    INTENTIONAL_WALK("IBB", "Intentional Walk", false, false, 0, 1, false),
    ERROR("E", "Reached on Error", false, false, 0, 1, false),
    FIELDERS_CHOICE("FC", "Fielder's Choice", false, false, 1, 1, false),
    SACRIFICE_FLY("SF", "Sacrifice Fly", false, true, 1, 0, false),
    STRIKEOUT("SO", "Strikeout", false, true, 1, 0, true),
    GROUND_OUT("GO", "Ground Out", false, true, 1, 0, true),
    AIR_OUT("AO", "Air Out", false, true, 1, 0, true),
    DOUBLE_PLAY("DP", "Double Play", false, true, 2, 0, false);

    /** Bases-loaded home run ceiling. */
    public static final int MAX_RBIS_PER_PLAY = 4;

    private final String code;
    private final String label;
    private final boolean hit;
    private final boolean out;
    private final int outsRecorded;
    private final int batterBases;
    private final boolean forbidsRbi;

    BattingResult(String code, String label, boolean hit, boolean out, int outsRecorded, int batterBases,
                  boolean forbidsRbi) {
        this.code = code;
        this.label = label;
        this.hit = hit;
        this.out = out;
        this.outsRecorded = outsRecorded;
        this.batterBases = batterBases;
        this.forbidsRbi = forbidsRbi;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public boolean isHit() {
        return hit;
    }

    /** True when the batter himself is retired. */
    public boolean isOut() {
        return out;
    }

    /** Outs the result records by itself (a fielder's choice retires a runner, not the batter). */
    public int outsRecorded() {
        return outsRecorded;
    }

    /** Bases the batter earns; a home run is 4. */
    public int batterBases() {
        return batterBases;
    }

    public boolean reachesBase() {
        return batterBases > 0;
    }

    public boolean forbidsRbi() {
        return forbidsRbi;
    }

    public boolean isWalk() {
        return this == WALK || this == INTENTIONAL_WALK;
    }

    /** Walks and sacrifices are plate appearances that do not count as official at-bats. */
    public boolean countsAsAtBat() {
        return !isWalk() && this != SACRIFICE_FLY;
    }

    public static BattingResult fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Batting result code is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (BattingResult result : values()) {
            if (result.code.equals(normalized)) return result;
        }
        throw new IllegalArgumentException("Unknown batting result code: " + code);
    }
}
