package com.scorekeeperapp.scoring.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized rule switches and game-ending settings.
 *
 * <pre>
 * scorekeeper:
 *   rules:
 *     error-attribution: true
 *     outs-accounting: true
 *     outcome-matrix: false
 *     extended-running-errors: true
 *   game:
 *     regulation-innings: 7
 *     mercy-run-differential: 10
 *     mercy-from-inning: 5
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "scorekeeper")
public class ScorekeeperProperties {

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Game game = new Game();

    @Getter
    @Setter
    public static class Rules {
        private boolean errorAttribution = true;
        private boolean outsAccounting = true;
        private boolean outcomeMatrix = false;
        private boolean extendedRunningErrors = true;
    }

    @Getter
    @Setter
    public static class Game {

        @Min(1)
        @Max(12)
        private int regulationInnings = 7;

        /** 0 turns the mercy rule off. */
        @Min(0)
        private int mercyRunDifferential = 10;

        @Min(1)
        private int mercyFromInning = 5;
    }
}
