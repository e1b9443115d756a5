package com.scorekeeperapp.scoring.repository;

import com.scorekeeperapp.scoring.domain.atbat.AtBat;

import java.util.List;

public interface AtBatRepository {

    AtBat save(AtBat atBat);

    /** At-bats of a game in the order they were recorded. */
    List<AtBat> findByGameId(String gameId);
}
