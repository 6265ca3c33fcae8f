package com.gnovoa.gridiron.model;

public record ScheduledGame(
    String gameId,
    int week,
    String homeTeamId,
    String awayTeamId,
    Integer homeScore,
    Integer awayScore,
    boolean completed) {

  public static ScheduledGame unplayed(String gameId, int week, String homeTeamId, String awayTeamId) {
    return new ScheduledGame(gameId, week, homeTeamId, awayTeamId, null, null, false);
  }

  public ScheduledGame withResult(int home, int away) {
    return new ScheduledGame(gameId, week, homeTeamId, awayTeamId, home, away, true);
  }

  public boolean involves(String teamId) {
    return homeTeamId.equals(teamId) || awayTeamId.equals(teamId);
  }

  public String opponentOf(String teamId) {
    return homeTeamId.equals(teamId) ? awayTeamId : homeTeamId;
  }

  public boolean isTie() {
    return completed && homeScore.equals(awayScore);
  }

  /** Winner id, or null for an unplayed or tied game. */
  public String winnerId() {
    if (!completed || homeScore.equals(awayScore)) return null;
    return homeScore > awayScore ? homeTeamId : awayTeamId;
  }
}
