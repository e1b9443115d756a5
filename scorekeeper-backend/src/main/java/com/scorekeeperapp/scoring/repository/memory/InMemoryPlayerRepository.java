package com.scorekeeperapp.scoring.repository.memory;

import com.scorekeeperapp.scoring.domain.player.Player;
import com.scorekeeperapp.scoring.repository.PlayerRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryPlayerRepository implements PlayerRepository {

    private final Map<String, Player> players = new ConcurrentHashMap<>();

    @Override
    public boolean existsById(String id) {
        return id != null && players.containsKey(id);
    }

    @Override
    public Optional<Player> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(players.get(id));
    }

    @Override
    public Player save(Player player) {
        players.put(player.id(), player);
        return player;
    }
}
