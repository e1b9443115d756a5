package com.scorekeeperapp.scoring.service;

import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.common.exception.NotFoundException;
import com.scorekeeperapp.common.exception.ScoringExceptions;
import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.game.Game;
import com.scorekeeperapp.scoring.domain.game.GameProgression;
import com.scorekeeperapp.scoring.domain.game.GameRules;
import com.scorekeeperapp.scoring.domain.game.GameSnapshot;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.game.request.CreateGameRequest;
import com.scorekeeperapp.scoring.dto.game.request.GameActionRequest;
import com.scorekeeperapp.scoring.dto.game.request.RecordOpponentHalfInningRequest;
import com.scorekeeperapp.scoring.dto.game.response.GameResponse;
import com.scorekeeperapp.scoring.dto.game.response.LineScoreResponse;
import com.scorekeeperapp.scoring.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameRepository gameRepository;
    private final GameProgression gameProgression;
    private final GameRules gameRules;
    private final GameLocks gameLocks;
    private final Clock clock;

    public ApiResponse<GameResponse> create(CreateGameRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");

        String name = trimToNull(request.name());
        if (name == null) throw new BadRequestException("name is required");
        String opponent = trimToNull(request.opponent());
        if (opponent == null) throw new BadRequestException("opponent is required");
        if (request.ourSide() == null) throw new BadRequestException("ourSide is required");

        Game game = Game.create(UUID.randomUUID().toString(), name, opponent, request.ourSide(), gameRules,
                clock.instant());
        gameRepository.save(game);
        log.info("Game created: id={}, opponent={}, ourSide={}", game.getId(), opponent, request.ourSide());
        return ApiResponse.ok("Game created", toResponse(GameSnapshot.of(game)));
    }

    public ApiResponse<GameResponse> detail(GameActionRequest request) {
        String gameId = requireGameId(request);
        GameSnapshot snapshot = gameLocks.withLock(gameId, () -> GameSnapshot.of(load(gameId)));
        return ApiResponse.ok("Game loaded", toResponse(snapshot));
    }

    public ApiResponse<GameResponse> start(GameActionRequest request) {
        GameSnapshot snapshot = transition(requireGameId(request), "start", gameProgression::start);
        log.info("Game started: id={}", snapshot.id());
        return ApiResponse.ok("Game started", toResponse(snapshot));
    }

    public ApiResponse<GameResponse> suspend(GameActionRequest request) {
        GameSnapshot snapshot = transition(requireGameId(request), "suspend", gameProgression::suspend);
        log.info("Game suspended: id={}, inning={}", snapshot.id(), snapshot.inning());
        return ApiResponse.ok("Game suspended", toResponse(snapshot));
    }

    public ApiResponse<GameResponse> complete(GameActionRequest request) {
        GameSnapshot snapshot = transition(requireGameId(request), "complete", gameProgression::complete);
        log.info("Game completed: id={}, reason={}, score={}-{}", snapshot.id(), snapshot.completionReason(),
                snapshot.awayRuns(), snapshot.homeRuns());
        return ApiResponse.ok("Game completed", toResponse(snapshot));
    }

    public ApiResponse<GameResponse> recordOpponentHalfInning(RecordOpponentHalfInningRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.runs() == null) throw new BadRequestException("runs is required");
        String gameId = requireGameId(new GameActionRequest(request.gameId()));

        GameSnapshot snapshot = transition(gameId, "opponent half-inning",
                game -> gameProgression.recordOpponentHalfInning(game, request.runs()));
        log.info("Opponent half-inning recorded: id={}, runs={}, status={}", gameId, request.runs(), snapshot.status());
        return ApiResponse.ok("Opponent half-inning recorded", toResponse(snapshot));
    }

    private GameSnapshot transition(String gameId, String action, Function<Game, Result<Void>> step) {
        return gameLocks.withLock(gameId, () -> {
            Game game = load(gameId);
            Result<Void> result = step.apply(game);
            if (result.isFailure()) {
                log.debug("Game {} rejected for {}: {} {}", gameId, action,
                        result.getError().code(), result.getError().message());
                throw ScoringExceptions.toException(result.getError());
            }
            gameRepository.save(game);
            return GameSnapshot.of(game);
        });
    }

    private Game load(String gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new NotFoundException("Game not found", ErrorCode.GAME_NOT_FOUND.name(),
                        Map.of("gameId", gameId)));
    }

    private static String requireGameId(GameActionRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        String gameId = trimToNull(request.gameId());
        if (gameId == null) throw new BadRequestException("gameId is required");
        return gameId;
    }

    private GameResponse toResponse(GameSnapshot s) {
        return new GameResponse(
                s.id(),
                s.name(),
                s.opponent(),
                s.ourSide(),
                s.status(),
                s.inning(),
                s.half(),
                s.battingSide(),
                s.outs(),
                s.homeRuns(),
                s.awayRuns(),
                s.lineScore().stream()
                        .map(e -> new LineScoreResponse(e.inning(), e.awayRuns(), e.homeRuns()))
                        .toList(),
                s.nextBattingOrder(),
                s.nextBatterId(),
                s.lineupSet(),
                s.completionReason()
        );
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
