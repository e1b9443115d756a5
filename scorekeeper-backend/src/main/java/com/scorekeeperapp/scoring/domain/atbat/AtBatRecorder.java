package com.scorekeeperapp.scoring.domain.atbat;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementEngine;
import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleValidation;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;
import com.scorekeeperapp.scoring.domain.game.Game;
import com.scorekeeperapp.scoring.domain.game.GameProgression;
import com.scorekeeperapp.scoring.domain.game.Inning;
import com.scorekeeperapp.scoring.domain.lineup.LineupSlot;
import com.scorekeeperapp.scoring.domain.outcome.BattingResult;
import com.scorekeeperapp.scoring.repository.AtBatRepository;
import com.scorekeeperapp.scoring.repository.GameRepository;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Records one plate appearance against a game.
 *
 * Checks run in a fixed order and the first failure is returned. The game is only touched
 * once every check has passed, so a rejected command leaves innings and score as they were.
 * Callers must not record concurrently against the same game.
 */
public class AtBatRecorder {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private final GameRepository games;
    private final AtBatRepository atBats;
    private final AdvancementEngine engine;
    private final GameProgression progression;
    private final RuleConfiguration configuration;
    private final Clock clock;

    public AtBatRecorder(GameRepository games, AtBatRepository atBats, AdvancementEngine engine,
                         GameProgression progression, RuleConfiguration configuration, Clock clock) {
        this.games = games;
        this.atBats = atBats;
        this.engine = engine;
        this.progression = progression;
        this.configuration = configuration;
        this.clock = clock;
    }

    public Result<AtBat> recordAtBat(RecordAtBatCommand command) {
        Optional<Game> found = games.findById(command.gameId());
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.GAME_NOT_FOUND, "Game not found",
                    Map.of("gameId", String.valueOf(command.gameId())));
        }
        Game game = found.get();
        if (!game.isInProgress()) {
            return Result.failure(ErrorCode.GAME_NOT_IN_PROGRESS,
                    "Cannot record an at-bat while the game is " + game.getStatus(),
                    Map.of("status", game.getStatus().name()));
        }

        if (command.batterId() == null || command.batterId().isBlank()) {
            return Result.failure(ErrorCode.BATTER_REQUIRED, "Batter ID is required");
        }
        if (command.inning() < 1) {
            return Result.failure(ErrorCode.INVALID_INNING, "Inning must be a positive number",
                    Map.of("inning", command.inning()));
        }
        if (command.result() == null) {
            return Result.failure(ErrorCode.RESULT_REQUIRED, "Batting result is required");
        }
        if (command.runsScored().stream().anyMatch(id -> id == null || id.isBlank())) {
            return Result.failure(ErrorCode.PLAYER_REQUIRED, "Scoring player IDs cannot be blank");
        }

        if (command.rbis() < 0) {
            return Result.failure(ErrorCode.NEGATIVE_RBI, "RBI cannot be negative", Map.of("rbis", command.rbis()));
        }
        if (command.description().length() > MAX_DESCRIPTION_LENGTH) {
            return Result.failure(ErrorCode.DESCRIPTION_TOO_LONG, "Description cannot exceed 500 characters",
                    Map.of("length", command.description().length()));
        }

        BattingResult result = command.result();
        if (result.forbidsRbi() && command.rbis() > 0) {
            return Result.failure(ErrorCode.RBI_NOT_ALLOWED, "Strikeouts and groundouts cannot have RBIs",
                    Map.of("result", result.code(), "rbis", command.rbis()));
        }

        Set<String> scorers = new HashSet<>(command.runsScored());
        boolean exempt = configuration.isRbiExempt(result, command.parameters().errorOccurred());
        if (exempt ? command.rbis() > scorers.size() : command.rbis() != scorers.size()) {
            return Result.failure(ErrorCode.RBI_MISMATCH, "RBI count must match runs scored",
                    Map.of("rbis", command.rbis(), "runsScored", scorers.size()));
        }

        if (command.rbis() > BattingResult.MAX_RBIS_PER_PLAY) {
            return Result.failure(ErrorCode.RBI_LIMIT_EXCEEDED, "Maximum RBI per at-bat is 4",
                    Map.of("rbis", command.rbis()));
        }

        if (scorers.size() != command.runsScored().size()) {
            return Result.failure(ErrorCode.DUPLICATE_SCORER, "A player cannot score multiple times in the same at-bat");
        }

        Inning inning = game.getCurrentInning();
        PlayScenario scenario = new PlayScenario(
                command.baserunnersBefore(),
                result,
                command.batterId(),
                command.parameters(),
                command.baserunnersAfter(),
                command.runsScored(),
                command.rbis(),
                inning.getOuts());
        RuleValidation validation = engine.validate(scenario, configuration);
        if (!validation.isValid()) {
            RuleViolation first = validation.firstViolation().orElseThrow();
            Map<String, Object> details = new LinkedHashMap<>(first.toError().details());
            details.put("violations", validation.violations().stream().map(RuleViolation::message).toList());
            return Result.failure(first.rule().errorCode(), first.message(), details);
        }

        if (result == BattingResult.HOME_RUN && !command.baserunnersAfter().isEmpty()) {
            return Result.failure(ErrorCode.HOME_RUN_BASES_NOT_CLEARED, "A home run must clear all bases");
        }

        if (inning.getNumber() != command.inning() || inning.isTop() != command.topOfInning()) {
            return Result.failure(ErrorCode.WRONG_HALF_INNING,
                    "The game is in the " + inning.getHalf().name().toLowerCase(Locale.ROOT) + " of inning " + inning.getNumber(),
                    Map.of("inning", inning.getNumber(), "half", inning.getHalf().name()));
        }
        if (inning.battingSide() != game.getOurSide()) {
            return Result.failure(ErrorCode.WRONG_HALF_INNING, "The opponent is batting in this half-inning",
                    Map.of("inning", inning.getNumber(), "half", inning.getHalf().name()));
        }

        Optional<LineupSlot> slot = game.getLineup().slotOf(command.batterId());
        if (slot.isEmpty()) {
            return Result.failure(ErrorCode.BATTER_NOT_IN_LINEUP,
                    "Batter " + command.batterId() + " is not in the lineup",
                    Map.of("batterId", command.batterId()));
        }

        int outs = scenario.outsOnPlay();
        List<String> runsScored = command.runsScored();
        AtBat atBat = new AtBat(
                UUID.randomUUID().toString(),
                game.getId(),
                inning.getId(),
                command.batterId(),
                slot.get().battingOrder(),
                result,
                command.description(),
                command.rbis(),
                runsScored,
                command.baserunnersBefore(),
                command.baserunnersAfter(),
                outs,
                command.parameters(),
                clock.instant());

        progression.applyPlay(game, atBat.id(), atBat.battingPosition(), runsScored.size(), outs);
        atBats.save(atBat);
        games.save(game);
        return Result.success(atBat);
    }
}
