package com.gnovoa.gridiron.model;

import java.util.List;

public record DraftPick(
    String pickId,
    int year,
    int round,
    int pickInRound,
    int overallPick,
    String originalTeamId,
    String currentTeamId,
    String selectedPlayerId,
    List<String> tradeHistory) {

  public DraftPick {
    tradeHistory = tradeHistory == null ? List.of() : List.copyOf(tradeHistory);
  }

  public boolean isUsed() {
    return selectedPlayerId != null;
  }

  public DraftPick withSelection(String playerId) {
    return new DraftPick(pickId, year, round, pickInRound, overallPick, originalTeamId,
        currentTeamId, playerId, tradeHistory);
  }
}
