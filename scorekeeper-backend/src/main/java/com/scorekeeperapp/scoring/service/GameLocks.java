package com.scorekeeperapp.scoring.service;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped game locks. Every call that reads then writes a game runs under the stripe its id
 * hashes to, so the engine sees a single writer per game. The stripe count is fixed, so ids
 * of unknown or finished games leave nothing behind.
 */
@Component
public class GameLocks {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public GameLocks() {
        this(DEFAULT_STRIPES);
    }

    GameLocks(int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("stripeCount must be >= 1");
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String gameId, Supplier<T> action) {
        ReentrantLock lock = lockFor(gameId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String gameId) {
        return stripes[Math.floorMod(Objects.hashCode(gameId), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
