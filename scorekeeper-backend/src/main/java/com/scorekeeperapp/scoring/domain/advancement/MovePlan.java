package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.bases.Base;
import com.scorekeeperapp.scoring.domain.bases.BaseShape;

/**
 * Where each participant of a play finishes, keyed by starting base (0 is the batter).
 * Finishes are a base number, {@link #HOME}, {@link #OUT}, or {@link #ABSENT} when nobody started there.
 */
record MovePlan(int batter, int first, int second, int third) {

    static final int ABSENT = -1;
    static final int OUT = 0;
    static final int HOME = Base.HOME;

    static MovePlan holding(BaseShape shape, int batterFinish) {
        return new MovePlan(
                batterFinish,
                shape.isOccupied(Base.FIRST) ? 1 : ABSENT,
                shape.isOccupied(Base.SECOND) ? 2 : ABSENT,
                shape.isOccupied(Base.THIRD) ? 3 : ABSENT);
    }

    static MovePlan of(int[] finishes) {
        return new MovePlan(finishes[0], finishes[1], finishes[2], finishes[3]);
    }

    int finish(int start) {
        return switch (start) {
            case 0 -> batter;
            case 1 -> first;
            case 2 -> second;
            case 3 -> third;
            default -> throw new IllegalArgumentException("Unknown starting base " + start);
        };
    }

    MovePlan with(int start, int finish) {
        int[] finishes = toArray();
        finishes[start] = finish;
        return of(finishes);
    }

    int[] toArray() {
        return new int[]{batter, first, second, third};
    }

    int outs() {
        int outs = 0;
        for (int f : toArray()) {
            if (f == OUT) outs++;
        }
        return outs;
    }

    /**
     * No retreating, at most one runner per base, and no runner finishing level with or
     * ahead of a runner who started in front of him unless that runner scored.
     */
    boolean isConsistent() {
        int[] finishes = toArray();
        for (int start = 1; start <= 3; start++) {
            int f = finishes[start];
            if (f != ABSENT && f != OUT && f < start) return false;
        }
        for (int trail = 0; trail <= 3; trail++) {
            int ft = finishes[trail];
            if (ft == ABSENT || ft == OUT) continue;
            for (int lead = trail + 1; lead <= 3; lead++) {
                int fl = finishes[lead];
                if (fl == ABSENT || fl == OUT || fl == HOME) continue;
                if (ft >= fl) return false;
            }
        }
        return true;
    }
}
