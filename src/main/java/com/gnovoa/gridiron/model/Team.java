package com.gnovoa.gridiron.model;

import java.util.List;

public record Team(
    String teamId,
    String city,
    String nickname,
    String abbreviation,
    Conference conference,
    Division division,
    List<String> rosterPlayerIds,
    TeamRecord currentRecord,
    TeamRecord allTimeRecord,
    int championships,
    Integer lastChampionshipYear,
    Integer playoffSeed,
    TeamFinances finances,
    CoachingStaff staff) {

  public Team {
    rosterPlayerIds = rosterPlayerIds == null ? List.of() : List.copyOf(rosterPlayerIds);
    if (currentRecord == null) currentRecord = TeamRecord.EMPTY;
    if (allTimeRecord == null) allTimeRecord = TeamRecord.EMPTY;
    if (staff == null) staff = CoachingStaff.VACANT;
  }

  public String fullName() {
    return city + " " + nickname;
  }

  public int rosterSize() {
    return rosterPlayerIds.size();
  }

  public Team withRoster(List<String> roster) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, roster,
        currentRecord, allTimeRecord, championships, lastChampionshipYear, playoffSeed, finances, staff);
  }

  public Team withCurrentRecord(TeamRecord record) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        record, allTimeRecord, championships, lastChampionshipYear, playoffSeed, finances, staff);
  }

  public Team withAllTimeRecord(TeamRecord record) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        currentRecord, record, championships, lastChampionshipYear, playoffSeed, finances, staff);
  }

  /** Credits one more title, won in {@code year}. */
  public Team withChampionshipWon(int year) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        currentRecord, allTimeRecord, championships + 1, year, playoffSeed, finances, staff);
  }

  public Team withPlayoffSeed(Integer seed) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        currentRecord, allTimeRecord, championships, lastChampionshipYear, seed, finances, staff);
  }

  public Team withFinances(TeamFinances newFinances) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        currentRecord, allTimeRecord, championships, lastChampionshipYear, playoffSeed, newFinances, staff);
  }

  public Team withStaff(CoachingStaff newStaff) {
    return new Team(teamId, city, nickname, abbreviation, conference, division, rosterPlayerIds,
        currentRecord, allTimeRecord, championships, lastChampionshipYear, playoffSeed, finances, newStaff);
  }
}
