package com.gnovoa.gridiron.model;

/** Win/loss/tie record plus points, used for both the current season and the all-time tally. */
public record TeamRecord(int wins, int losses, int ties, int pointsFor, int pointsAgainst) {

  public static final TeamRecord EMPTY = new TeamRecord(0, 0, 0, 0, 0);

  public int games() {
    return wins + losses + ties;
  }

  /** Ties count as half a win. Zero when no games were played. */
  public double winPercentage() {
    int games = games();
    if (games == 0) return 0.0;
    return (wins + ties * 0.5) / games;
  }

  public int pointDifferential() {
    return pointsFor - pointsAgainst;
  }

  public TeamRecord withGame(int scored, int allowed) {
    return new TeamRecord(
        wins + (scored > allowed ? 1 : 0),
        losses + (scored < allowed ? 1 : 0),
        ties + (scored == allowed ? 1 : 0),
        pointsFor + scored,
        pointsAgainst + allowed);
  }

  public TeamRecord plus(TeamRecord other) {
    return new TeamRecord(
        wins + other.wins,
        losses + other.losses,
        ties + other.ties,
        pointsFor + other.pointsFor,
        pointsAgainst + other.pointsAgainst);
  }

  @Override
  public String toString() {
    return ties == 0 ? wins + "-" + losses : wins + "-" + losses + "-" + ties;
  }
}
