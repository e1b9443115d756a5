package com.scorekeeperapp.scoring.service;

import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.common.exception.NotFoundException;
import com.scorekeeperapp.common.exception.ScoringExceptions;
import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.OutcomeParameters;
import com.scorekeeperapp.scoring.domain.atbat.AtBat;
import com.scorekeeperapp.scoring.domain.atbat.AtBatRecorder;
import com.scorekeeperapp.scoring.domain.atbat.RecordAtBatCommand;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.domain.game.Game;
import com.scorekeeperapp.scoring.domain.game.GameStatus;
import com.scorekeeperapp.scoring.dto.atbat.request.ListAtBatsRequest;
import com.scorekeeperapp.scoring.dto.atbat.request.RecordAtBatRequest;
import com.scorekeeperapp.scoring.dto.atbat.response.AtBatResponse;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import com.scorekeeperapp.scoring.repository.AtBatRepository;
import com.scorekeeperapp.scoring.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AtBatService {

    private final AtBatRecorder atBatRecorder;
    private final AtBatRepository atBatRepository;
    private final GameRepository gameRepository;
    private final GameLocks gameLocks;

    public ApiResponse<AtBatResponse> record(RecordAtBatRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.gameId() == null || request.gameId().isBlank()) throw new BadRequestException("gameId is required");
        RecordAtBatCommand command = toCommand(request);

        List<String> warnings = new ArrayList<>();
        AtBat atBat = gameLocks.withLock(command.gameId(), () -> {
            Result<AtBat> result = atBatRecorder.recordAtBat(command);
            if (result.isFailure()) {
                log.debug("At-bat rejected for game {}: {} {}", command.gameId(),
                        result.getError().code(), result.getError().message());
                throw ScoringExceptions.toException(result.getError());
            }
            gameRepository.findById(command.gameId())
                    .filter(g -> g.getStatus() == GameStatus.COMPLETED)
                    .ifPresent(g -> warnings.add("Game completed: " + g.getCompletionReason()));
            return result.getValue();
        });

        log.info("At-bat recorded: game={}, batter={}, result={}, runs={}, rbis={}, outs={}",
                atBat.gameId(), atBat.batterId(), atBat.result().code(), atBat.runs(), atBat.rbis(),
                atBat.outsOnPlay());
        return ApiResponse.ok("At-bat recorded", toResponse(atBat), warnings);
    }

    public ApiResponse<List<AtBatResponse>> list(ListAtBatsRequest request) {
        if (request == null || request.gameId() == null || request.gameId().isBlank()) {
            throw new BadRequestException("gameId is required");
        }
        Game game = gameRepository.findById(request.gameId())
                .orElseThrow(() -> new NotFoundException("Game not found", ErrorCode.GAME_NOT_FOUND.name(),
                        Map.of("gameId", request.gameId())));

        List<AtBatResponse> atBats = atBatRepository.findByGameId(game.getId()).stream()
                .map(this::toResponse)
                .toList();
        return ApiResponse.ok("At-bats loaded", atBats);
    }

    private RecordAtBatCommand toCommand(RecordAtBatRequest r) {
        BaserunnerState before;
        BaserunnerState after;
        try {
            before = BasesPayload.toState(r.baserunnersBefore());
            after = BasesPayload.toState(r.baserunnersAfter());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), ErrorCode.INCONSISTENT_RUNNERS.name(), null);
        }
        OutcomeParameters parameters = new OutcomeParameters(
                r.aggressiveness(),
                Boolean.TRUE.equals(r.errorOccurred()),
                Boolean.TRUE.equals(r.runningErrorOccurred()));

        return new RecordAtBatCommand(
                r.gameId(),
                r.batterId(),
                r.inning() == null ? 0 : r.inning(),
                Boolean.TRUE.equals(r.topOfInning()),
                r.result(),
                r.description(),
                r.rbis() == null ? 0 : r.rbis(),
                before,
                after,
                r.runsScored(),
                parameters
        );
    }

    private AtBatResponse toResponse(AtBat a) {
        return new AtBatResponse(
                a.id(),
                a.gameId(),
                a.inningId(),
                a.batterId(),
                a.battingPosition(),
                a.result(),
                a.result().code(),
                a.description(),
                a.rbis(),
                a.runsScored(),
                BasesPayload.from(a.baserunnersBefore()),
                BasesPayload.from(a.baserunnersAfter()),
                a.outsOnPlay(),
                a.timestamp()
        );
    }
}
