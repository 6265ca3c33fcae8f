package com.gnovoa.gridiron.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Regular-season schedule: 18 weeks, 17 games and one bye per team. */
public record SeasonSchedule(
    int year, List<ScheduledGame> games, Map<String, Integer> byeWeeks, ScheduleStrategy strategy) {

  public static final int WEEKS = 18;
  public static final int GAMES_PER_TEAM = 17;

  public SeasonSchedule {
    var sorted = new ArrayList<>(games);
    sorted.sort(Comparator.comparingInt(ScheduledGame::week));
    games = List.copyOf(sorted);
    byeWeeks = Collections.unmodifiableMap(new LinkedHashMap<>(byeWeeks));
  }

  public List<ScheduledGame> gamesInWeek(int week) {
    return games.stream().filter(g -> g.week() == week).toList();
  }

  public List<ScheduledGame> gamesFor(String teamId) {
    return games.stream().filter(g -> g.involves(teamId)).toList();
  }

  public Integer byeWeekOf(String teamId) {
    return byeWeeks.get(teamId);
  }

  public boolean isComplete() {
    return games.stream().allMatch(ScheduledGame::completed);
  }

  public SeasonSchedule withGames(List<ScheduledGame> newGames) {
    return new SeasonSchedule(year, newGames, byeWeeks, strategy);
  }
}
