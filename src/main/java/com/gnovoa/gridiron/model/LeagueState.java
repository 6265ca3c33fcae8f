package com.gnovoa.gridiron.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the whole league.
 *
 * <p>Maps keep insertion order so that iterating them (and therefore consuming random numbers) is
 * reproducible. Every stage of the season and offseason pipeline takes a state and returns a new
 * one.
 */
public record LeagueState(
    int year,
    Map<String, Team> teams,
    Map<String, Player> players,
    Map<String, Contract> contracts,
    Map<String, Coach> coaches,
    List<DraftPick> draftPicks,
    List<Prospect> draftClass,
    SeasonSchedule schedule,
    List<HistoricalSeasonSummary> seasonHistory) {

  public LeagueState {
    teams = ordered(teams);
    players = ordered(players);
    contracts = ordered(contracts);
    coaches = ordered(coaches);
    draftPicks = draftPicks == null ? List.of() : List.copyOf(draftPicks);
    draftClass = draftClass == null ? List.of() : List.copyOf(draftClass);
    seasonHistory = seasonHistory == null ? List.of() : List.copyOf(seasonHistory);
  }

  private static <K, V> Map<K, V> ordered(Map<K, V> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  public Team team(String teamId) {
    return teams.get(teamId);
  }

  public Player player(String playerId) {
    return players.get(playerId);
  }

  public LeagueState withYear(int newYear) {
    return new LeagueState(newYear, teams, players, contracts, coaches, draftPicks, draftClass,
        schedule, seasonHistory);
  }

  public LeagueState withTeams(Map<String, Team> newTeams) {
    return new LeagueState(year, newTeams, players, contracts, coaches, draftPicks, draftClass,
        schedule, seasonHistory);
  }

  public LeagueState withPlayers(Map<String, Player> newPlayers) {
    return new LeagueState(year, teams, newPlayers, contracts, coaches, draftPicks, draftClass,
        schedule, seasonHistory);
  }

  public LeagueState withContracts(Map<String, Contract> newContracts) {
    return new LeagueState(year, teams, players, newContracts, coaches, draftPicks, draftClass,
        schedule, seasonHistory);
  }

  public LeagueState withCoaches(Map<String, Coach> newCoaches) {
    return new LeagueState(year, teams, players, contracts, newCoaches, draftPicks, draftClass,
        schedule, seasonHistory);
  }

  public LeagueState withDraftPicks(List<DraftPick> picks) {
    return new LeagueState(year, teams, players, contracts, coaches, picks, draftClass, schedule,
        seasonHistory);
  }

  public LeagueState withDraftClass(List<Prospect> prospects) {
    return new LeagueState(year, teams, players, contracts, coaches, draftPicks, prospects,
        schedule, seasonHistory);
  }

  public LeagueState withSchedule(SeasonSchedule newSchedule) {
    return new LeagueState(year, teams, players, contracts, coaches, draftPicks, draftClass,
        newSchedule, seasonHistory);
  }

  public LeagueState withSeasonHistory(List<HistoricalSeasonSummary> history) {
    return new LeagueState(year, teams, players, contracts, coaches, draftPicks, draftClass,
        schedule, history);
  }
}
