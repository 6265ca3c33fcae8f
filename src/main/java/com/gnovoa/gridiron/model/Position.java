package com.gnovoa.gridiron.model;

/** Roster positions, with the depth a team tries to carry at each one. */
public enum Position {
  QB(Side.OFFENSE, 2),
  RB(Side.OFFENSE, 3),
  WR(Side.OFFENSE, 5),
  TE(Side.OFFENSE, 3),
  LT(Side.OFFENSE, 2),
  LG(Side.OFFENSE, 2),
  C(Side.OFFENSE, 2),
  RG(Side.OFFENSE, 2),
  RT(Side.OFFENSE, 2),
  DE(Side.DEFENSE, 4),
  DT(Side.DEFENSE, 3),
  OLB(Side.DEFENSE, 3),
  ILB(Side.DEFENSE, 3),
  CB(Side.DEFENSE, 5),
  FS(Side.DEFENSE, 2),
  SS(Side.DEFENSE, 2),
  K(Side.SPECIAL_TEAMS, 1),
  P(Side.SPECIAL_TEAMS, 1);

  public enum Side {
    OFFENSE,
    DEFENSE,
    SPECIAL_TEAMS
  }

  private final Side side;
  private final int idealCount;

  Position(Side side, int idealCount) {
    this.side = side;
    this.idealCount = idealCount;
  }

  public Side side() {
    return side;
  }

  public int idealCount() {
    return idealCount;
  }

  public boolean isOffense() {
    return side == Side.OFFENSE;
  }

  public boolean isDefense() {
    return side == Side.DEFENSE;
  }

  public boolean isSpecialist() {
    return side == Side.SPECIAL_TEAMS;
  }
}
