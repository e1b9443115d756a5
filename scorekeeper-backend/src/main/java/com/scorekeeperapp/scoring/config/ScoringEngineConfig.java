package com.scorekeeperapp.scoring.config;

import com.scorekeeperapp.scoring.domain.advancement.AdvancementEngine;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.atbat.AtBatRecorder;
import com.scorekeeperapp.scoring.domain.game.GameProgression;
import com.scorekeeperapp.scoring.domain.game.GameRules;
import com.scorekeeperapp.scoring.domain.lineup.LineupSetup;
import com.scorekeeperapp.scoring.domain.lineup.LineupValidator;
import com.scorekeeperapp.scoring.repository.AtBatRepository;
import com.scorekeeperapp.scoring.repository.GameRepository;
import com.scorekeeperapp.scoring.repository.PlayerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free engine classes into the application context.
 */
@Slf4j
@Configuration
public class ScoringEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleConfiguration ruleConfiguration(ScorekeeperProperties properties) {
        ScorekeeperProperties.Rules rules = properties.getRules();
        RuleConfiguration configuration = RuleConfiguration.defaults().toBuilder()
                .errorAttribution(rules.isErrorAttribution())
                .outsAccounting(rules.isOutsAccounting())
                .enforceOutcomeMatrix(rules.isOutcomeMatrix())
                .extendedRunningErrors(rules.isExtendedRunningErrors())
                .build();
        log.info("Scoring rules: errorAttribution={}, outsAccounting={}, outcomeMatrix={}, extendedRunningErrors={}",
                configuration.errorAttribution(), configuration.outsAccounting(),
                configuration.enforceOutcomeMatrix(), configuration.extendedRunningErrors());
        return configuration;
    }

    @Bean
    public GameRules gameRules(ScorekeeperProperties properties) {
        ScorekeeperProperties.Game game = properties.getGame();
        return new GameRules(game.getRegulationInnings(), game.getMercyRunDifferential(), game.getMercyFromInning());
    }

    @Bean
    public AdvancementEngine advancementEngine() {
        return new AdvancementEngine();
    }

    @Bean
    public GameProgression gameProgression(Clock clock) {
        return new GameProgression(clock);
    }

    @Bean
    public LineupValidator lineupValidator() {
        return new LineupValidator();
    }

    @Bean
    public LineupSetup lineupSetup(GameRepository games, PlayerRepository players, LineupValidator validator) {
        return new LineupSetup(games, players, validator);
    }

    @Bean
    public AtBatRecorder atBatRecorder(GameRepository games, AtBatRepository atBats, AdvancementEngine engine,
                                       GameProgression progression, RuleConfiguration configuration, Clock clock) {
        return new AtBatRecorder(games, atBats, engine, progression, configuration, clock);
    }
}
