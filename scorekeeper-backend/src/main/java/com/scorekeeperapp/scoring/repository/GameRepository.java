package com.scorekeeperapp.scoring.repository;

import com.scorekeeperapp.scoring.domain.game.Game;

import java.util.Optional;

public interface GameRepository {

    Optional<Game> findById(String id);

    Game save(Game game);
}
