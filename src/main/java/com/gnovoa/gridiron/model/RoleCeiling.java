package com.gnovoa.gridiron.model;

/** Scouting projection of a prospect's best-case role, with the grade AI teams draft by. */
public enum RoleCeiling {
  FRANCHISE_CORNERSTONE(100),
  HIGH_END_STARTER(80),
  SOLID_STARTER(60),
  QUALITY_ROTATIONAL(40),
  SPECIALIST(35),
  DEPTH(25),
  PRACTICE_SQUAD(10);

  private final int draftGrade;

  RoleCeiling(int draftGrade) {
    this.draftGrade = draftGrade;
  }

  public int draftGrade() {
    return draftGrade;
  }
}
