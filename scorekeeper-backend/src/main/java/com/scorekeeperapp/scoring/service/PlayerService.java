package com.scorekeeperapp.scoring.service;

import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.scoring.domain.player.Player;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.player.request.RegisterPlayerRequest;
import com.scorekeeperapp.scoring.dto.player.response.PlayerResponse;
import com.scorekeeperapp.scoring.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerService {

    private final PlayerRepository playerRepository;

    public ApiResponse<PlayerResponse> register(RegisterPlayerRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.name() == null || request.name().isBlank()) throw new BadRequestException("name is required");

        Player player = playerRepository.save(new Player(UUID.randomUUID().toString(), request.name().trim()));
        log.info("Player registered: id={}", player.id());
        return ApiResponse.ok("Player registered", new PlayerResponse(player.id(), player.name()));
    }
}
