package com.scorekeeperapp.scoring.service;

import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.common.exception.ScoringExceptions;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.lineup.Lineup;
import com.scorekeeperapp.scoring.domain.lineup.LineupEntry;
import com.scorekeeperapp.scoring.domain.lineup.LineupSetup;
import com.scorekeeperapp.scoring.domain.lineup.SetupLineupCommand;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.lineup.request.SetupLineupRequest;
import com.scorekeeperapp.scoring.dto.lineup.request.SubstitutePlayerRequest;
import com.scorekeeperapp.scoring.dto.lineup.response.LineupResponse;
import com.scorekeeperapp.scoring.dto.lineup.response.LineupSlotResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LineupService {

    private final LineupSetup lineupSetup;
    private final GameLocks gameLocks;

    public ApiResponse<LineupResponse> setup(SetupLineupRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.gameId() == null || request.gameId().isBlank()) throw new BadRequestException("gameId is required");
        if (request.entries() == null) throw new BadRequestException("entries is required");

        List<LineupEntry> entries = request.entries().stream()
                .map(e -> new LineupEntry(e.battingOrder(), e.playerId(), e.position()))
                .toList();
        SetupLineupCommand command = new SetupLineupCommand(request.gameId(), entries, request.substitutes());

        Lineup lineup = gameLocks.withLock(request.gameId(),
                () -> unwrap(lineupSetup.setupLineup(command), "lineup setup", request.gameId()));
        log.info("Lineup set: game={}, substitutes={}", request.gameId(), lineup.substitutes().size());
        return ApiResponse.ok("Lineup saved", toResponse(request.gameId(), lineup));
    }

    public ApiResponse<LineupResponse> substitute(SubstitutePlayerRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.gameId() == null || request.gameId().isBlank()) throw new BadRequestException("gameId is required");
        if (request.battingOrder() == null) throw new BadRequestException("battingOrder is required");

        Lineup lineup = gameLocks.withLock(request.gameId(), () -> unwrap(
                lineupSetup.substitute(request.gameId(), request.battingOrder(), request.substituteId()),
                "substitution", request.gameId()));
        log.info("Substitution: game={}, battingOrder={}, substitute={}",
                request.gameId(), request.battingOrder(), request.substituteId());
        return ApiResponse.ok("Substitution applied", toResponse(request.gameId(), lineup));
    }

    private <T> T unwrap(Result<T> result, String action, String gameId) {
        if (result.isFailure()) {
            log.debug("{} rejected for game {}: {} {}", action, gameId,
                    result.getError().code(), result.getError().message());
        }
        return ScoringExceptions.unwrap(result);
    }

    private LineupResponse toResponse(String gameId, Lineup lineup) {
        return new LineupResponse(
                gameId,
                lineup.slots().stream()
                        .map(s -> new LineupSlotResponse(s.battingOrder(), s.playerId(), s.position()))
                        .toList(),
                lineup.substitutes()
        );
    }
}
