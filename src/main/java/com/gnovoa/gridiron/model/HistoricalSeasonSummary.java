package com.gnovoa.gridiron.model;

import java.util.List;

public record HistoricalSeasonSummary(
    int year,
    String championTeamId,
    TeamRecord championRecord,
    String runnerUpTeamId,
    List<String> playoffTeamIds,
    List<String> draftOrder) {

  public HistoricalSeasonSummary {
    playoffTeamIds = List.copyOf(playoffTeamIds);
    draftOrder = List.copyOf(draftOrder);
  }
}
