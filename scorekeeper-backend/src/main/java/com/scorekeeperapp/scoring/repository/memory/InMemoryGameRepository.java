package com.scorekeeperapp.scoring.repository.memory;

import com.scorekeeperapp.scoring.domain.game.Game;
import com.scorekeeperapp.scoring.repository.GameRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryGameRepository implements GameRepository {

    private final Map<String, Game> games = new ConcurrentHashMap<>();

    @Override
    public Optional<Game> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(games.get(id));
    }

    @Override
    public Game save(Game game) {
        games.put(game.getId(), game);
        return game;
    }
}
