package com.scorekeeperapp.scoring.dto.player.response;

public record PlayerResponse(
        String id,
        String name
) {}
