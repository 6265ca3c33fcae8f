package com.gnovoa.gridiron.model;

public enum SkillTier {
  ELITE(4),
  STARTER(3),
  BACKUP(2),
  FRINGE(1);

  private final int rank;

  SkillTier(int rank) {
    this.rank = rank;
  }

  /** Higher is better. */
  public int rank() {
    return rank;
  }

  public static SkillTier fromOverall(int overall) {
    if (overall >= 80) return ELITE;
    if (overall >= 68) return STARTER;
    if (overall >= 55) return BACKUP;
    return FRINGE;
  }
}
