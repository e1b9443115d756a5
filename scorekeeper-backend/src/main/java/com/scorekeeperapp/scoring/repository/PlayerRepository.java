package com.scorekeeperapp.scoring.repository;

import com.scorekeeperapp.scoring.domain.player.Player;

import java.util.Optional;

public interface PlayerRepository {

    boolean existsById(String id);

    Optional<Player> findById(String id);

    Player save(Player player);
}
