package com.gnovoa.gridiron.model;

/** A coach; {@code teamId} is null while the coach is unemployed. */
public record Coach(
    String coachId,
    String firstName,
    String lastName,
    CoachRole role,
    String teamId,
    CoachAttributes attributes,
    int age,
    int contractYearsRemaining,
    int hireYear) {

  public String fullName() {
    return firstName + " " + lastName;
  }

  public boolean isEmployed() {
    return teamId != null;
  }

  public Coach hiredBy(String newTeamId, int year, int contractYears) {
    return new Coach(coachId, firstName, lastName, role, newTeamId, attributes, age,
        contractYears, year);
  }

  public Coach released() {
    return new Coach(coachId, firstName, lastName, role, null, attributes, age, 0, hireYear);
  }

  public Coach withContractYearsRemaining(int years) {
    return new Coach(coachId, firstName, lastName, role, teamId, attributes, age, years, hireYear);
  }

  public Coach aged() {
    return new Coach(coachId, firstName, lastName, role, teamId, attributes, age + 1,
        contractYearsRemaining, hireYear);
  }
}
