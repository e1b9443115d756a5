package com.scorekeeperapp.scoring.domain.advancement;

public enum Aggressiveness {
    CONSERVATIVE,
    STANDARD,
    AGGRESSIVE
}
