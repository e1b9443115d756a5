package com.scorekeeperapp.scoring.domain.lineup;

import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.game.Game;
import com.scorekeeperapp.scoring.domain.game.GameStatus;
import com.scorekeeperapp.scoring.repository.GameRepository;
import com.scorekeeperapp.scoring.repository.PlayerRepository;

import java.util.Map;
import java.util.Optional;

/**
 * Attaches validated lineups to games and applies in-game substitutions.
 * Nothing is attached unless every check passes.
 */
public class LineupSetup {

    private final GameRepository games;
    private final PlayerRepository players;
    private final LineupValidator validator;

    public LineupSetup(GameRepository games, PlayerRepository players, LineupValidator validator) {
        this.games = games;
        this.players = players;
        this.validator = validator;
    }

    public Result<Lineup> setupLineup(SetupLineupCommand command) {
        Optional<Game> found = games.findById(command.gameId());
        if (found.isEmpty()) return gameNotFound(command.gameId());
        Game game = found.get();

        Result<Lineup> validated = validator.validate(command, players::existsById);
        if (validated.isFailure()) return validated;

        if (game.getStatus() != GameStatus.SETUP) {
            return Result.failure(ErrorCode.LINEUP_LOCKED, "Lineup can only be set while the game is in setup",
                    Map.of("status", game.getStatus().name()));
        }
        game.attachLineup(validated.getValue());
        games.save(game);
        return validated;
    }

    public Result<Lineup> substitute(String gameId, int battingOrder, String substituteId) {
        Optional<Game> found = games.findById(gameId);
        if (found.isEmpty()) return gameNotFound(gameId);
        Game game = found.get();

        if (!game.isInProgress()) {
            return Result.failure(ErrorCode.GAME_NOT_IN_PROGRESS, "Substitutions are only allowed while the game is in progress",
                    Map.of("status", game.getStatus().name()));
        }
        if (battingOrder < 1 || battingOrder > Lineup.SIZE) {
            return Result.failure(ErrorCode.BATTING_ORDER_INVALID, "Batting order must be between 1 and 9",
                    Map.of("battingOrder", battingOrder));
        }
        Lineup lineup = game.getLineup();
        if (substituteId == null || !lineup.isOnBench(substituteId)) {
            return Result.failure(ErrorCode.NOT_A_SUBSTITUTE, "Player " + substituteId + " is not on the bench",
                    Map.of("playerId", String.valueOf(substituteId)));
        }

        Lineup updated = lineup.substitute(battingOrder, substituteId);
        game.replaceLineup(updated);
        games.save(game);
        return Result.success(updated);
    }

    private static <T> Result<T> gameNotFound(String gameId) {
        return Result.failure(ErrorCode.GAME_NOT_FOUND, "Game not found", Map.of("gameId", String.valueOf(gameId)));
    }
}
