package com.scorekeeperapp.scoring.domain.lineup;

/**
 * One proposed starter as submitted; nothing is validated until the lineup is checked.
 */
public record LineupEntry(Integer battingOrder, String playerId, Position position) {}
