package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.player.request.RegisterPlayerRequest;
import com.scorekeeperapp.scoring.dto.player.response.PlayerResponse;
import com.scorekeeperapp.scoring.service.PlayerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/players")
public class PlayerController {

    private final PlayerService playerService;

    @PostMapping("/register")
    public ApiResponse<PlayerResponse> register(@Valid @RequestBody RegisterPlayerRequest request) {
        return playerService.register(request);
    }
}
