package com.scorekeeperapp.scoring.repository.memory;

import com.scorekeeperapp.scoring.domain.atbat.AtBat;
import com.scorekeeperapp.scoring.repository.AtBatRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryAtBatRepository implements AtBatRepository {

    private final Map<String, List<AtBat>> byGame = new ConcurrentHashMap<>();

    @Override
    public AtBat save(AtBat atBat) {
        byGame.computeIfAbsent(atBat.gameId(), k -> new CopyOnWriteArrayList<>()).add(atBat);
        return atBat;
    }

    @Override
    public List<AtBat> findByGameId(String gameId) {
        if (gameId == null) return List.of();
        return List.copyOf(byGame.getOrDefault(gameId, List.of()));
    }
}
