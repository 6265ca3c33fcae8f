package com.gnovoa.gridiron.model;

/** A draft-eligible player who has not yet entered the league. */
public record Prospect(
    String prospectId,
    String firstName,
    String lastName,
    Position position,
    int age,
    int overall,
    int potential,
    RoleCeiling ceiling,
    int draftYear) {

  /** The player this prospect becomes; drafted players carry draft info, UDFAs pass null. */
  public Player toPlayer(DraftInfo draft) {
    return new Player(prospectId, firstName, lastName, position, age, 0, overall, potential, null,
        Injury.NONE, draft);
  }
}
