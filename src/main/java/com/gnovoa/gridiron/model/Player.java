package com.gnovoa.gridiron.model;

/**
 * A player in the league universe.
 *
 * <p>A player without a contract id is unsigned; unsigned players are never on a roster after
 * roster maintenance.
 */
public record Player(
    String playerId,
    String firstName,
    String lastName,
    Position position,
    int age,
    int experience,
    int overall,
    int potential,
    String contractId,
    Injury injury,
    DraftInfo draft) {

  public Player {
    if (injury == null) injury = Injury.NONE;
  }

  public String fullName() {
    return firstName + " " + lastName;
  }

  public SkillTier tier() {
    return SkillTier.fromOverall(overall);
  }

  public boolean isSigned() {
    return contractId != null;
  }

  public Player withContract(String newContractId) {
    return new Player(playerId, firstName, lastName, position, age, experience, overall,
        potential, newContractId, injury, draft);
  }

  public Player unsigned() {
    return withContract(null);
  }

  public Player withInjury(Injury newInjury) {
    return new Player(playerId, firstName, lastName, position, age, experience, overall,
        potential, contractId, newInjury, draft);
  }

  public Player developed(int newAge, int newExperience, int newOverall) {
    return new Player(playerId, firstName, lastName, position, newAge, newExperience, newOverall,
        potential, contractId, injury, draft);
  }
}
