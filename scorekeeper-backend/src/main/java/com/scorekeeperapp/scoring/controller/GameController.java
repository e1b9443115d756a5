package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.game.request.CreateGameRequest;
import com.scorekeeperapp.scoring.dto.game.request.GameActionRequest;
import com.scorekeeperapp.scoring.dto.game.request.RecordOpponentHalfInningRequest;
import com.scorekeeperapp.scoring.dto.game.response.GameResponse;
import com.scorekeeperapp.scoring.service.GameService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/games")
public class GameController {

    private final GameService gameService;

    @PostMapping("/create")
    public ApiResponse<GameResponse> create(@Valid @RequestBody CreateGameRequest request) {
        return gameService.create(request);
    }

    @PostMapping("/detail")
    public ApiResponse<GameResponse> detail(@Valid @RequestBody GameActionRequest request) {
        return gameService.detail(request);
    }

    @PostMapping("/start")
    public ApiResponse<GameResponse> start(@Valid @RequestBody GameActionRequest request) {
        return gameService.start(request);
    }

    @PostMapping("/suspend")
    public ApiResponse<GameResponse> suspend(@Valid @RequestBody GameActionRequest request) {
        return gameService.suspend(request);
    }

    @PostMapping("/complete")
    public ApiResponse<GameResponse> complete(@Valid @RequestBody GameActionRequest request) {
        return gameService.complete(request);
    }

    @PostMapping("/opponent-half-inning")
    public ApiResponse<GameResponse> opponentHalfInning(@Valid @RequestBody RecordOpponentHalfInningRequest request) {
        return gameService.recordOpponentHalfInning(request);
    }
}
