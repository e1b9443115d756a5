package com.scorekeeperapp.scoring.domain.advancement;

import com.scorekeeperapp.scoring.domain.bases.Base;
import com.scorekeeperapp.scoring.domain.bases.BaseShape;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.scorekeeperapp.scoring.domain.advancement.MovePlan.ABSENT;
import static com.scorekeeperapp.scoring.domain.advancement.MovePlan.HOME;
import static com.scorekeeperapp.scoring.domain.advancement.MovePlan.OUT;

/**
 * Enumerates legal advancements as a function of (occupancy shape, result, parameters).
 * Works purely on base numbers; binding to player ids happens in {@link AdvancementCalculator}.
 */
final class OutcomeMatrix {

    private OutcomeMatrix() {}

    /**
     * Every plan the rules permit. Empty when the result cannot happen with this occupancy
     * (a sacrifice fly with nobody on third, a fielder's choice with the bases empty).
     */
    static Set<MovePlan> plans(BaseShape shape, BattingResult result, OutcomeParameters params,
                               boolean extendedRunningErrors) {
        Set<MovePlan> plans = switch (result) {
            case SINGLE, DOUBLE, TRIPLE -> hitPlans(shape, result.batterBases(), params);
            case ERROR -> hitPlans(shape, 1, params);
            case HOME_RUN -> Set.of(homeRun(shape));
            case WALK, INTENTIONAL_WALK -> Set.of(walk(shape));
            case STRIKEOUT -> Set.of(MovePlan.holding(shape, OUT));
            case GROUND_OUT, AIR_OUT -> outPlans(shape, params);
            case SACRIFICE_FLY -> sacrificeFlyPlans(shape, params);
            case FIELDERS_CHOICE -> fieldersChoicePlans(shape, params);
            case DOUBLE_PLAY -> doublePlayPlans(shape, params);
        };
        if (!params.runningErrorOccurred() || plans.isEmpty()) return plans;
        return withRunningErrors(plans, shape, result, extendedRunningErrors);
    }

    /** The single plan recorded when nothing unusual happens. */
    static Optional<MovePlan> canonical(BaseShape shape, BattingResult result) {
        return switch (result) {
            case SINGLE, DOUBLE, TRIPLE -> Optional.of(standardHit(shape, result.batterBases()));
            case ERROR -> Optional.of(standardHit(shape, 1));
            case HOME_RUN -> Optional.of(homeRun(shape));
            case WALK, INTENTIONAL_WALK -> Optional.of(walk(shape));
            case STRIKEOUT, GROUND_OUT, AIR_OUT -> Optional.of(MovePlan.holding(shape, OUT));
            case SACRIFICE_FLY -> shape.isOccupied(Base.THIRD)
                    ? Optional.of(MovePlan.holding(shape, OUT).with(3, HOME))
                    : Optional.empty();
            case FIELDERS_CHOICE -> shape == BaseShape.EMPTY
                    ? Optional.empty()
                    : Optional.of(MovePlan.of(forcedChain(shape, 1, EnumSet.of(choiceBase(shape)))));
            case DOUBLE_PLAY -> shape == BaseShape.EMPTY
                    ? Optional.empty()
                    : Optional.of(MovePlan.of(forcedChain(shape, OUT, EnumSet.of(choiceBase(shape)))));
        };
    }

    // the runner from first when there is one, otherwise the lead runner
    private static Base choiceBase(BaseShape shape) {
        return shape.isOccupied(Base.FIRST) ? Base.FIRST : shape.leadBase();
    }

    private static MovePlan standardHit(BaseShape shape, int bases) {
        int[] finishes = MovePlan.holding(shape, bases).toArray();
        for (Base base : shape.occupied()) {
            finishes[base.number()] = Math.min(HOME, base.number() + bases);
        }
        return MovePlan.of(finishes);
    }

    private static MovePlan homeRun(BaseShape shape) {
        int[] finishes = MovePlan.holding(shape, HOME).toArray();
        for (Base base : shape.occupied()) {
            finishes[base.number()] = HOME;
        }
        return MovePlan.of(finishes);
    }

    /** Batter to first; only forced runners move up. */
    private static MovePlan walk(BaseShape shape) {
        return switch (shape) {
            case EMPTY -> new MovePlan(1, ABSENT, ABSENT, ABSENT);
            case FIRST -> new MovePlan(1, 2, ABSENT, ABSENT);
            case SECOND -> new MovePlan(1, ABSENT, 2, ABSENT);
            case THIRD -> new MovePlan(1, ABSENT, ABSENT, 3);
            case FIRST_SECOND -> new MovePlan(1, 2, 3, ABSENT);
            case FIRST_THIRD -> new MovePlan(1, 2, ABSENT, 3);
            case SECOND_THIRD -> new MovePlan(1, ABSENT, 2, 3);
            case LOADED -> new MovePlan(1, 2, 3, HOME);
        };
    }

    private static Set<MovePlan> hitPlans(BaseShape shape, int bases, OutcomeParameters params) {
        List<Set<Integer>> candidates = new ArrayList<>(4);

        Set<Integer> batter = new LinkedHashSet<>();
        batter.add(bases);
        if (params.errorOccurred()) batter.add(Math.min(HOME, bases + 1));
        candidates.add(batter);

        for (Base base : Base.values()) {
            if (!shape.isOccupied(base)) {
                candidates.add(Set.of(ABSENT));
                continue;
            }
            int start = base.number();
            int standard = Math.min(HOME, start + bases);
            Set<Integer> options = new LinkedHashSet<>();
            options.add(standard);
            switch (params.aggressiveness()) {
                case CONSERVATIVE -> {
                    for (int f = start; f < standard; f++) options.add(f);
                }
                case AGGRESSIVE -> options.add(Math.min(HOME, standard + 1));
                case STANDARD -> { }
            }
            if (params.errorOccurred()) {
                for (Integer option : List.copyOf(options)) {
                    options.add(Math.min(HOME, option + 1));
                }
            }
            candidates.add(options);
        }
        return combine(candidates);
    }

    private static Set<MovePlan> outPlans(BaseShape shape, OutcomeParameters params) {
        List<Set<Integer>> candidates = new ArrayList<>(4);
        candidates.add(Set.of(OUT));
        for (Base base : Base.values()) {
            if (!shape.isOccupied(base)) {
                candidates.add(Set.of(ABSENT));
            } else if (base != Base.THIRD && params.aggressiveness() == Aggressiveness.AGGRESSIVE) {
                candidates.add(orderedSet(base.number(), base.number() + 1));
            } else {
                candidates.add(Set.of(base.number()));
            }
        }
        return combine(candidates);
    }

    private static Set<MovePlan> sacrificeFlyPlans(BaseShape shape, OutcomeParameters params) {
        if (!shape.isOccupied(Base.THIRD)) return Set.of();
        List<Set<Integer>> candidates = new ArrayList<>(4);
        candidates.add(Set.of(OUT));
        for (Base base : Base.values()) {
            if (!shape.isOccupied(base)) {
                candidates.add(Set.of(ABSENT));
            } else if (base == Base.THIRD) {
                candidates.add(Set.of(HOME));
            } else if (params.aggressiveness() == Aggressiveness.AGGRESSIVE) {
                candidates.add(orderedSet(base.number(), base.number() + 1));
            } else {
                candidates.add(Set.of(base.number()));
            }
        }
        return combine(candidates);
    }

    private static Set<MovePlan> fieldersChoicePlans(BaseShape shape, OutcomeParameters params) {
        if (shape == BaseShape.EMPTY) return Set.of();
        Set<MovePlan> plans = new LinkedHashSet<>();
        List<Base> choices = new ArrayList<>(shape.occupied());
        choices.remove(choiceBase(shape));
        choices.add(0, choiceBase(shape));
        for (Base retired : choices) {
            plans.addAll(afterOuts(shape, 1, EnumSet.of(retired), params));
        }
        return plans;
    }

    private static Set<MovePlan> doublePlayPlans(BaseShape shape, OutcomeParameters params) {
        if (shape == BaseShape.EMPTY) return Set.of();
        Set<MovePlan> plans = new LinkedHashSet<>();
        List<Base> runners = new ArrayList<>(shape.occupied());
        runners.remove(choiceBase(shape));
        runners.add(0, choiceBase(shape));

        // batter and one runner
        for (Base retired : runners) {
            plans.addAll(afterOuts(shape, OUT, EnumSet.of(retired), params));
        }
        // two runners, batter safe at first
        List<Base> occupied = new ArrayList<>(shape.occupied());
        for (int i = 0; i < occupied.size(); i++) {
            for (int j = i + 1; j < occupied.size(); j++) {
                plans.addAll(afterOuts(shape, 1, EnumSet.of(occupied.get(i), occupied.get(j)), params));
            }
        }
        return plans;
    }

    /**
     * Plans once the listed runners are retired: everybody else takes the forced minimum,
     * or one base more when running aggressively.
     */
    private static Set<MovePlan> afterOuts(BaseShape shape, int batterFinish, Set<Base> retired,
                                           OutcomeParameters params) {
        int[] forced = forcedChain(shape, batterFinish, retired);
        List<Set<Integer>> candidates = new ArrayList<>(4);
        candidates.add(Set.of(batterFinish));
        for (Base base : Base.values()) {
            int f = forced[base.number()];
            if (f == ABSENT || f == OUT || f == HOME || params.aggressiveness() != Aggressiveness.AGGRESSIVE) {
                candidates.add(Set.of(f));
            } else {
                candidates.add(orderedSet(f, f + 1));
            }
        }
        return combine(candidates);
    }

    /**
     * Minimum finishes working outward from the batter: each runner must end at least one base
     * ahead of the nearest trailing runner still on the field, and must score if that runner scored.
     */
    private static int[] forcedChain(BaseShape shape, int batterFinish, Set<Base> retired) {
        int[] finishes = {batterFinish, ABSENT, ABSENT, ABSENT};
        int trailing = batterFinish;
        for (Base base : Base.values()) {
            if (!shape.isOccupied(base)) continue;
            int start = base.number();
            if (retired.contains(base)) {
                finishes[start] = OUT;
                continue;
            }
            int f = (trailing == HOME) ? HOME : Math.max(start, trailing + 1);
            finishes[start] = f;
            trailing = f;
        }
        return finishes;
    }

    private static Set<MovePlan> withRunningErrors(Set<MovePlan> plans, BaseShape shape, BattingResult result,
                                                   boolean extended) {
        Set<MovePlan> all = new LinkedHashSet<>(plans);
        for (MovePlan plan : plans) {
            if (extended) {
                for (int start = 1; start <= 3; start++) {
                    int f = plan.finish(start);
                    if (f != ABSENT && f != OUT) all.add(plan.with(start, OUT));
                }
            } else if (result == BattingResult.SINGLE && shape.isOccupied(Base.FIRST) && plan.finish(1) != OUT) {
                all.add(plan.with(1, OUT));
            }
        }
        return all;
    }

    private static Set<MovePlan> combine(List<Set<Integer>> candidates) {
        Set<MovePlan> plans = new LinkedHashSet<>();
        for (int b : candidates.get(0)) {
            for (int f : candidates.get(1)) {
                for (int s : candidates.get(2)) {
                    for (int t : candidates.get(3)) {
                        MovePlan plan = new MovePlan(b, f, s, t);
                        if (plan.isConsistent()) plans.add(plan);
                    }
                }
            }
        }
        return plans;
    }

    private static Set<Integer> orderedSet(int first, int second) {
        Set<Integer> set = new LinkedHashSet<>();
        set.add(first);
        set.add(Math.min(HOME, second));
        return set;
    }
}
