package com.scorekeeperapp.scoring.domain.advancement;

/**
 * Situational inputs that widen or narrow the set of legal advancements for a play.
 */
public record OutcomeParameters(Aggressiveness aggressiveness, boolean errorOccurred, boolean runningErrorOccurred) {

    public OutcomeParameters {
        if (aggressiveness == null) aggressiveness = Aggressiveness.STANDARD;
    }

    public static OutcomeParameters standard() {
        return new OutcomeParameters(Aggressiveness.STANDARD, false, false);
    }

    public static OutcomeParameters conservative() {
        return new OutcomeParameters(Aggressiveness.CONSERVATIVE, false, false);
    }

    public static OutcomeParameters aggressive() {
        return new OutcomeParameters(Aggressiveness.AGGRESSIVE, false, false);
    }

    public static OutcomeParameters fieldingError() {
        return new OutcomeParameters(Aggressiveness.STANDARD, true, false);
    }

    public static OutcomeParameters runningError() {
        return new OutcomeParameters(Aggressiveness.STANDARD, false, true);
    }

    public OutcomeParameters withAggressiveness(Aggressiveness value) {
        return new OutcomeParameters(value, errorOccurred, runningErrorOccurred);
    }
}
