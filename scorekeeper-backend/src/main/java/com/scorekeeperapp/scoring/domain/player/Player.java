package com.scorekeeperapp.scoring.domain.player;

public record Player(String id, String name) {

    public Player {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    }
}
